/*
 * どこで: Box 更新の再試行制御
 * 何を: 指数バックオフ + 一様ジッタの待機時間を計算する
 * なぜ: 同じ Box を奪い合う書き込み同士の再衝突タイミングをずらすため
 */
package com.example.lockbox.box.service;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Delay formula: {@code floor(baseDelayMs * multiplier^attempt) + uniform[0, maxJitterMs]}.
 */
public final class ExponentialJitterBackoffPolicy implements BackoffPolicy {

  private final long baseDelayMs;
  private final double multiplier;
  private final long maxJitterMs;

  public ExponentialJitterBackoffPolicy(long baseDelayMs, double multiplier, long maxJitterMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
    }
    if (maxJitterMs < 0) {
      throw new IllegalArgumentException("maxJitterMs must be >= 0, got: " + maxJitterMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.multiplier = multiplier;
    this.maxJitterMs = maxJitterMs;
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    final double exponential = Math.floor(baseDelayMs * Math.pow(multiplier, attempt));
    // 上限は long に収める。通常の再試行回数では到達しない
    final long delay = exponential >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) exponential;
    final long jitter =
        maxJitterMs == 0 ? 0L : ThreadLocalRandom.current().nextLong(maxJitterMs + 1);
    return delay > Long.MAX_VALUE - jitter ? Long.MAX_VALUE : delay + jitter;
  }
}
