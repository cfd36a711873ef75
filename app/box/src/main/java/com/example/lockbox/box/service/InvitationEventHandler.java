/*
 * どこで: Box サービス層(招待イベント)
 * 何を: 招待サービスが発行したイベントをガーディアンのライフサイクル遷移へ変換する
 * なぜ: at-least-once 配信で同じイベントが再送されても、Box の状態を一度だけ変えるため
 */
package com.example.lockbox.box.service;

import com.example.lockbox.box.model.BoxRecord;
import com.example.lockbox.box.model.GuardianStatus;
import com.example.lockbox.box.repository.BoxNotFoundException;
import com.example.lockbox.common.event.InvitationEventPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class InvitationEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(InvitationEventHandler.class);

  private final GuardianLifecycleService guardianLifecycleService;
  private final BoxMetrics metrics;
  private final ObjectMapper objectMapper;

  /**
   * @throws InvitationEventPermanentException 必須項目の欠落など、再配信しても成功しないイベントの場合
   */
  public InvitationEventOutcome handle(InvitationEventPayload event) {
    if (event == null) {
      throw permanent("invitation event is empty");
    }
    final String eventType = event.eventType();
    if (eventType == null || eventType.isBlank()) {
      throw permanent("invitation event_type is missing");
    }
    final InvitationEventOutcome outcome =
        switch (eventType) {
          case InvitationEventPayload.INVITATION_CREATED -> {
            logger.info(
                "invitation created box_id={} invitation_id={}",
                event.boxId(),
                event.invitationId());
            yield InvitationEventOutcome.IGNORED;
          }
          case InvitationEventPayload.INVITATION_VIEWED,
              InvitationEventPayload.INVITATION_OPENED -> handleViewed(event);
          default -> {
            logger.warn("unsupported invitation event_type={} ignored", eventType);
            yield InvitationEventOutcome.IGNORED;
          }
        };
    metrics.recordInvitationEvent(outcome.name().toLowerCase(Locale.ROOT));
    return outcome;
  }

  /** 不正な要素はスキップし、残りの処理を続ける。 */
  public InvitationBatchResult handleBatch(List<JsonNode> items) {
    int applied = 0;
    int ignored = 0;
    int skipped = 0;
    int failed = 0;
    for (JsonNode item : items) {
      try {
        final InvitationEventPayload event =
            objectMapper.treeToValue(item, InvitationEventPayload.class);
        if (handle(event) == InvitationEventOutcome.APPLIED) {
          applied++;
        } else {
          ignored++;
        }
      } catch (JsonProcessingException | InvitationEventPermanentException ex) {
        logger.warn("invitation event skipped: {}", ex.getMessage());
        skipped++;
      } catch (RuntimeException ex) {
        logger.error("invitation event failed in batch", ex);
        metrics.recordInvitationEvent("failed");
        failed++;
      }
    }
    logger.info(
        "invitation batch processed applied={} ignored={} skipped={} failed={}",
        applied,
        ignored,
        skipped,
        failed);
    return new InvitationBatchResult(applied, ignored, skipped, failed);
  }

  private InvitationEventOutcome handleViewed(InvitationEventPayload event) {
    if (isBlank(event.boxId()) || isBlank(event.invitationId())) {
      throw permanent("invitation event requires boxId and invitationId");
    }
    if (isBlank(event.userId())) {
      throw permanent("invitation_viewed event requires userId: invitation_id=" + event.invitationId());
    }
    try {
      final BoxRecord box =
          guardianLifecycleService.markViewed(event.boxId(), event.invitationId(), event.userId());
      // accepted/rejected 済みや未知の招待は何も変えないため IGNORED
      return box.findGuardianByInvitationId(event.invitationId())
              .filter(g -> g.hasId(event.userId()) && g.status() == GuardianStatus.VIEWED)
              .isPresent()
          ? InvitationEventOutcome.APPLIED
          : InvitationEventOutcome.IGNORED;
    } catch (BoxNotFoundException ex) {
      // 削除済みの Box 宛てのイベントは再配信しても変わらないため成功扱い
      logger.warn(
          "invitation event target not found box_id={} invitation_id={}: {}",
          event.boxId(),
          event.invitationId(),
          ex.getMessage());
      return InvitationEventOutcome.IGNORED;
    } catch (InvalidBoxOperationException ex) {
      metrics.recordInvitationEvent("invalid");
      throw new InvitationEventPermanentException(ex.getMessage(), ex);
    }
  }

  private InvitationEventPermanentException permanent(String message) {
    metrics.recordInvitationEvent("invalid");
    return new InvitationEventPermanentException(message);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
