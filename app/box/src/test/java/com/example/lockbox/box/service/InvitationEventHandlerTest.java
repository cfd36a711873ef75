/*
 * どこで: 招待イベント処理のテスト
 * 何を: イベント種別ごとの反映/無視、恒久的失敗の判定、一括処理での不正要素スキップを検証する
 * なぜ: 再配信や不正イベントがあっても Box の状態と処理継続性を保つため
 */
package com.example.lockbox.box.service;

import static com.example.lockbox.box.BoxFixtures.CLOCK;
import static com.example.lockbox.box.BoxFixtures.accepted;
import static com.example.lockbox.box.BoxFixtures.box;
import static com.example.lockbox.box.BoxFixtures.executor;
import static com.example.lockbox.box.BoxFixtures.invited;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.lockbox.box.model.GuardianStatus;
import com.example.lockbox.box.repository.InMemoryBoxRepository;
import com.example.lockbox.common.event.InvitationEventPayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InvitationEventHandlerTest {

  private final JsonMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
  private InMemoryBoxRepository repository;
  private SimpleMeterRegistry registry;
  private InvitationEventHandler handler;

  @BeforeEach
  void setUp() {
    repository = new InMemoryBoxRepository(CLOCK);
    registry = new SimpleMeterRegistry();
    handler =
        new InvitationEventHandler(
            new GuardianLifecycleService(executor(repository, registry)),
            new BoxMetrics(registry),
            objectMapper);
    repository.create(box("box-1", invited("placeholder", "inv-1", false)));
  }

  @Test
  void viewedEventMarksGuardianViewed() {
    final InvitationEventOutcome outcome =
        handler.handle(event(InvitationEventPayload.INVITATION_VIEWED, "box-1", "inv-1", "user-1"));

    assertThat(outcome).isEqualTo(InvitationEventOutcome.APPLIED);
    assertThat(
            repository.findById("box-1").orElseThrow().findGuardianById("user-1").orElseThrow().status())
        .isEqualTo(GuardianStatus.VIEWED);
    assertThat(registry.get("box.invitation.event.total").tag("result", "applied").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void replayedViewedEventDoesNotWriteAgain() {
    handler.handle(event(InvitationEventPayload.INVITATION_VIEWED, "box-1", "inv-1", "user-1"));
    handler.handle(event(InvitationEventPayload.INVITATION_OPENED, "box-1", "inv-1", "user-1"));

    assertThat(repository.findById("box-1").orElseThrow().version()).isEqualTo(1L);
  }

  @Test
  void createdEventIsAcknowledgedWithoutChange() {
    final InvitationEventOutcome outcome =
        handler.handle(event(InvitationEventPayload.INVITATION_CREATED, "box-1", "inv-1", null));

    assertThat(outcome).isEqualTo(InvitationEventOutcome.IGNORED);
    assertThat(repository.findById("box-1").orElseThrow().version()).isZero();
  }

  @Test
  void unknownBoxOrInvitationIsIgnored() {
    assertThat(handler.handle(event(InvitationEventPayload.INVITATION_VIEWED, "gone", "inv-1", "u")))
        .isEqualTo(InvitationEventOutcome.IGNORED);
    assertThat(handler.handle(event(InvitationEventPayload.INVITATION_VIEWED, "box-1", "inv-x", "u")))
        .isEqualTo(InvitationEventOutcome.IGNORED);
    assertThat(repository.findById("box-1").orElseThrow().version()).isZero();
  }

  @Test
  void viewedEventWithoutUserIsPermanentFailure() {
    assertThatThrownBy(
            () -> handler.handle(event(InvitationEventPayload.INVITATION_VIEWED, "box-1", "inv-1", null)))
        .isInstanceOf(InvitationEventPermanentException.class);
    assertThatThrownBy(() -> handler.handle(event(null, "box-1", "inv-1", "user-1")))
        .isInstanceOf(InvitationEventPermanentException.class);
  }

  @Test
  void batchSkipsMalformedItemsAndContinues() throws Exception {
    final List<JsonNode> items =
        List.of(
            objectMapper.readTree("\"not-an-object\""),
            objectMapper.readTree(
                """
                {"event_type":"invitation_viewed","box_id":"box-1","invitation_id":"inv-1"}
                """),
            objectMapper.readTree(
                """
                {"event_type":"invitation_viewed","box_id":"box-1","invitation_id":"inv-1",
                 "user_id":"user-1","timestamp":"2026-03-01T00:00:00Z"}
                """),
            objectMapper.readTree(
                """
                {"event_type":"invitation_created","boxId":"box-1","invitationId":"inv-2"}
                """));

    final InvitationBatchResult result = handler.handleBatch(items);

    assertThat(result).isEqualTo(new InvitationBatchResult(1, 1, 2, 0));
    assertThat(repository.findById("box-1").orElseThrow().findGuardianById("user-1")).isPresent();
  }

  @Test
  void eventForAnsweredGuardianIsIgnored() {
    repository.create(box("box-2", accepted("user-2", "inv-2", false)));

    final InvitationEventOutcome outcome =
        handler.handle(event(InvitationEventPayload.INVITATION_VIEWED, "box-2", "inv-2", "user-2"));

    assertThat(outcome).isEqualTo(InvitationEventOutcome.IGNORED);
    assertThat(repository.findById("box-2").orElseThrow().version()).isZero();
    assertThat(registry.get("box.invitation.event.total").tag("result", "ignored").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void userIdOfAnotherGuardianIsPermanentAndCountedInvalid() {
    repository.create(
        box("box-3", accepted("user-1", "inv-0", false), invited("placeholder", "inv-1", false)));

    assertThatThrownBy(
            () ->
                handler.handle(
                    event(InvitationEventPayload.INVITATION_VIEWED, "box-3", "inv-1", "user-1")))
        .isInstanceOf(InvitationEventPermanentException.class);
    assertThat(registry.get("box.invitation.event.total").tag("result", "invalid").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void nullBatchItemIsSkipped() throws Exception {
    final List<JsonNode> items =
        List.of(
            objectMapper.readTree("null"),
            objectMapper.readTree(
                """
                {"event_type":"invitation_viewed","box_id":"box-1","invitation_id":"inv-1"}
                """),
            objectMapper.readTree(
                """
                {"event_type":"invitation_viewed","box_id":"box-1","invitation_id":"inv-1",
                 "user_id":"user-1"}
                """));

    final InvitationBatchResult result = handler.handleBatch(items);

    assertThat(result).isEqualTo(new InvitationBatchResult(1, 0, 2, 0));
  }

  private static InvitationEventPayload event(
      String eventType, String boxId, String invitationId, String userId) {
    return new InvitationEventPayload(
        eventType, invitationId, boxId, userId, null, "2026-03-01T00:00:00Z");
  }
}
