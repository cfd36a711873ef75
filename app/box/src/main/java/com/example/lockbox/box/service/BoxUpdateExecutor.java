/*
 * どこで: Box サービス層(再試行制御)
 * 何を: Box の読み取り-変更-書き込みを実行し、version 競合時は指数バックオフで再試行する
 * なぜ: ロックなしで複数の書き込み手が同じ Box を更新しても更新を失わないようにするため
 */
package com.example.lockbox.box.service;

import com.example.lockbox.box.config.BoxRetryProperties;
import com.example.lockbox.box.model.BoxRecord;
import com.example.lockbox.box.repository.BoxNotFoundException;
import com.example.lockbox.box.repository.BoxRepository;
import com.example.lockbox.box.repository.BoxStoreException;
import com.example.lockbox.box.repository.VersionConflictException;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class BoxUpdateExecutor {

  private static final Logger logger = LoggerFactory.getLogger(BoxUpdateExecutor.class);

  private final BoxRepository boxRepository;
  private final BackoffPolicy backoffPolicy;
  private final Sleeper sleeper;
  private final BoxMetrics metrics;
  private final int maxRetries;

  public BoxUpdateExecutor(
      BoxRepository boxRepository,
      BackoffPolicy backoffPolicy,
      Sleeper sleeper,
      BoxMetrics metrics,
      BoxRetryProperties retryProperties) {
    this.boxRepository = boxRepository;
    this.backoffPolicy = backoffPolicy;
    this.sleeper = sleeper;
    this.metrics = metrics;
    this.maxRetries = retryProperties.maxRetries();
  }

  /** 再試行上限到達時の照合を行わない更新。 */
  public BoxRecord execute(String boxId, BoxMutation mutation) {
    return execute(boxId, mutation, current -> false);
  }

  /**
   * @param reconciliation 再試行上限に達した後、最新の Box で意図した結果が既に成立しているかを判定する
   * @return コミット後の Box。変更不要だった場合は読み取った Box
   * @throws BoxNotFoundException Box が存在しない場合(再試行しない)
   * @throws VersionConflictException 再試行上限まで競合し、照合も成立しなかった場合
   */
  public BoxRecord execute(
      String boxId, BoxMutation mutation, Predicate<BoxRecord> reconciliation) {
    int attempts = 0;
    while (true) {
      // 毎回最新の集約を読み直し、古いコピーを再適用しない
      final BoxRecord current =
          boxRepository.findById(boxId).orElseThrow(() -> new BoxNotFoundException(boxId));
      final Optional<BoxRecord> next = mutation.apply(current);
      if (next.isEmpty()) {
        logger.debug("box mutation not needed box_id={} version={}", boxId, current.version());
        return current;
      }
      if (next.get().version() != current.version()) {
        throw new IllegalStateException(
            "mutation must not change version: box_id=" + boxId);
      }
      try {
        final BoxRecord committed = boxRepository.update(next.get());
        if (attempts > 0) {
          logger.info(
              "box update committed after retry box_id={} attempts={} version={}",
              boxId,
              attempts + 1,
              committed.version());
        }
        return committed;
      } catch (VersionConflictException ex) {
        attempts++;
        if (attempts >= maxRetries) {
          return reconcile(boxId, reconciliation, ex, attempts);
        }
        metrics.recordRetry();
        final long delayMs = backoffPolicy.computeDelayMs(attempts);
        logger.info(
            "box version conflict, retrying box_id={} attempt={}/{} delay_ms={}",
            boxId,
            attempts,
            maxRetries,
            delayMs);
        backoff(boxId, delayMs);
      }
    }
  }

  private BoxRecord reconcile(
      String boxId,
      Predicate<BoxRecord> reconciliation,
      VersionConflictException lastConflict,
      int attempts) {
    final Optional<BoxRecord> latest;
    try {
      latest = boxRepository.findById(boxId);
    } catch (RuntimeException ex) {
      logger.error("failed to read box for reconciliation box_id={}", boxId, ex);
      lastConflict.addSuppressed(ex);
      metrics.recordConflictExhausted();
      throw lastConflict;
    }
    if (latest.isPresent() && reconciliation.test(latest.get())) {
      // 他の書き込み手が同じ変更を既に適用済みなら成功として扱う
      logger.info(
          "box update already applied by another writer box_id={} attempts={} version={}",
          boxId,
          attempts,
          latest.get().version());
      metrics.recordReconciled();
      return latest.get();
    }
    logger.error(
        "box update failed after retries box_id={} attempts={} expected_version={}",
        boxId,
        attempts,
        lastConflict.expectedVersion());
    metrics.recordConflictExhausted();
    throw lastConflict;
  }

  private void backoff(String boxId, long delayMs) {
    try {
      sleeper.sleep(Duration.ofMillis(delayMs));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new BoxStoreException("interrupted while backing off: box_id=" + boxId, ex);
    }
  }
}
