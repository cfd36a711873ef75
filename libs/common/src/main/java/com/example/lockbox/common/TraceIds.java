/*
 * どこで: 共通ユーティリティ
 * 何を: HTTP の X-Request-Id や NATS の Nats-Msg-Id からログ用の追跡 ID を決める
 * なぜ: 外部から渡る値をそのまま MDC に積まず、欠落時は採番して追跡を途切れさせないため
 */
package com.example.lockbox.common;

import java.util.UUID;

public final class TraceIds {

  static final int MAX_LENGTH = 128;

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 空・空白・長すぎる値は採用せず新しい ID を返す。 */
  public static String resolve(String candidate) {
    if (candidate == null) {
      return newTraceId();
    }
    final String trimmed = candidate.trim();
    if (trimmed.isEmpty() || trimmed.length() > MAX_LENGTH) {
      return newTraceId();
    }
    return trimmed;
  }
}
