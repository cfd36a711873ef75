/*
 * どこで: Box サービス層
 * 何を: 楽観的排他の再試行と招待イベント処理結果のメトリクスを記録する
 * なぜ: 競合の多発や再試行上限到達を Prometheus から観測できるようにするため
 */
package com.example.lockbox.box.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class BoxMetrics {

  private static final String METRIC_UPDATE_RETRY_TOTAL = "box.update.retry.total";
  private static final String METRIC_UPDATE_CONFLICT_EXHAUSTED_TOTAL =
      "box.update.conflict.exhausted.total";
  private static final String METRIC_UPDATE_RECONCILED_TOTAL = "box.update.reconciled.total";
  private static final String METRIC_INVITATION_EVENT_TOTAL = "box.invitation.event.total";

  private final MeterRegistry meterRegistry;
  private final Counter retryCounter;
  private final Counter conflictExhaustedCounter;
  private final Counter reconciledCounter;
  private final ConcurrentMap<String, Counter> invitationEventCounters = new ConcurrentHashMap<>();

  public BoxMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.retryCounter =
        Counter.builder(METRIC_UPDATE_RETRY_TOTAL)
            .description("Box updates retried after a version conflict")
            .register(meterRegistry);
    this.conflictExhaustedCounter =
        Counter.builder(METRIC_UPDATE_CONFLICT_EXHAUSTED_TOTAL)
            .description("Box updates that failed after exhausting retries")
            .register(meterRegistry);
    this.reconciledCounter =
        Counter.builder(METRIC_UPDATE_RECONCILED_TOTAL)
            .description("Box updates found already applied by another writer after retries")
            .register(meterRegistry);
  }

  public void recordRetry() {
    retryCounter.increment();
  }

  public void recordConflictExhausted() {
    conflictExhaustedCounter.increment();
  }

  public void recordReconciled() {
    reconciledCounter.increment();
  }

  public void recordInvitationEvent(String result) {
    invitationEventCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_INVITATION_EVENT_TOTAL)
                    .description("Invitation event handling outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }
}
