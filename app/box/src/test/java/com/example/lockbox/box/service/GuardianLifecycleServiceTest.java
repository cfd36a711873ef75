/*
 * どこで: ガーディアン招待ライフサイクルのテスト
 * 何を: 招待閲覧/応答の遷移、冪等性、同時閲覧時の収束を検証する
 * なぜ: at-least-once のイベント配信と同時更新でガーディアン状態が壊れないことを保証するため
 */
package com.example.lockbox.box.service;

import static com.example.lockbox.box.BoxFixtures.CLOCK;
import static com.example.lockbox.box.BoxFixtures.accepted;
import static com.example.lockbox.box.BoxFixtures.box;
import static com.example.lockbox.box.BoxFixtures.executor;
import static com.example.lockbox.box.BoxFixtures.invited;
import static com.example.lockbox.box.BoxFixtures.withStatus;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.lockbox.box.model.BoxRecord;
import com.example.lockbox.box.model.Guardian;
import com.example.lockbox.box.model.GuardianIdentity;
import com.example.lockbox.box.model.GuardianStatus;
import com.example.lockbox.box.repository.BoxNotFoundException;
import com.example.lockbox.box.repository.InMemoryBoxRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GuardianLifecycleServiceTest {

  private InMemoryBoxRepository repository;
  private GuardianLifecycleService service;

  @BeforeEach
  void setUp() {
    repository = new InMemoryBoxRepository(CLOCK);
    service = new GuardianLifecycleService(executor(repository));
  }

  @Test
  void markViewedReplacesPlaceholderWithUser() {
    repository.create(box("box-1", invited("placeholder", "inv-1", false)));

    final BoxRecord updated = service.markViewed("box-1", "inv-1", "user-42");

    final Guardian guardian = updated.findGuardianByInvitationId("inv-1").orElseThrow();
    assertThat(guardian.id()).isEqualTo("user-42");
    assertThat(guardian.identity()).isEqualTo(new GuardianIdentity.Resolved("user-42"));
    assertThat(guardian.status()).isEqualTo(GuardianStatus.VIEWED);
    assertThat(updated.version()).isEqualTo(1L);
  }

  @Test
  void unknownInvitationLeavesBoxUnchanged() {
    repository.create(box("box-1", invited("placeholder", "inv-1", false)));

    final BoxRecord result = service.markViewed("box-1", "inv-x", "user-1");

    assertThat(result.version()).isZero();
    assertThat(repository.findById("box-1").orElseThrow().version()).isZero();
    assertThat(result.guardians()).containsExactly(invited("placeholder", "inv-1", false));
  }

  @Test
  void markViewedTwiceDoesNotWriteAgain() {
    repository.create(box("box-1", invited("placeholder", "inv-1", false)));

    final BoxRecord first = service.markViewed("box-1", "inv-1", "user-42");
    final BoxRecord second = service.markViewed("box-1", "inv-1", "user-42");

    assertThat(second).isEqualTo(first);
    assertThat(repository.findById("box-1").orElseThrow().version()).isEqualTo(1L);
  }

  @Test
  void markViewedLeavesRespondedGuardianUntouched() {
    repository.create(box("box-1", accepted("user-42", "inv-1", false)));

    final BoxRecord result = service.markViewed("box-1", "inv-1", "user-7");

    assertThat(result.version()).isZero();
    assertThat(result.findGuardianByInvitationId("inv-1").orElseThrow().id()).isEqualTo("user-42");
  }

  @Test
  void markViewedRejectsUserAlreadyGuardingThisBox() {
    repository.create(
        box("box-1", accepted("user-42", "inv-1", false), invited("placeholder", "inv-2", false)));

    assertThatThrownBy(() -> service.markViewed("box-1", "inv-2", "user-42"))
        .isInstanceOf(InvalidBoxOperationException.class);
    assertThat(repository.findById("box-1").orElseThrow().version()).isZero();
  }

  @Test
  void markViewedOnMissingBoxIsNotFound() {
    assertThatThrownBy(() -> service.markViewed("missing", "inv-1", "user-1"))
        .isInstanceOf(BoxNotFoundException.class);
  }

  @Test
  void respondAcceptsViewedInvitation() {
    repository.create(box("box-1", withStatus("user-1", "inv-1", GuardianStatus.VIEWED, false)));

    final BoxRecord updated = service.respondToInvitation("box-1", "user-1", true);

    assertThat(updated.findGuardianById("user-1").orElseThrow().status())
        .isEqualTo(GuardianStatus.ACCEPTED);
    assertThat(updated.version()).isEqualTo(1L);
  }

  @Test
  void respondAcceptsInvitationNotYetViewed() {
    // 閲覧イベントより先に応答が届いた場合も invited から直接遷移できる
    repository.create(box("box-1", invited("user-1", "inv-1", false)));

    final BoxRecord updated = service.respondToInvitation("box-1", "user-1", true);

    assertThat(updated.findGuardianById("user-1").orElseThrow().status())
        .isEqualTo(GuardianStatus.ACCEPTED);
  }

  @Test
  void respondRejectsInvitation() {
    repository.create(box("box-1", withStatus("user-1", "inv-1", GuardianStatus.VIEWED, false)));

    final BoxRecord updated = service.respondToInvitation("box-1", "user-1", false);

    assertThat(updated.findGuardianById("user-1").orElseThrow().status())
        .isEqualTo(GuardianStatus.REJECTED);
  }

  @Test
  void respondWithoutPendingInvitationIsBadRequest() {
    repository.create(box("box-1", accepted("user-1", "inv-1", false)));

    assertThatThrownBy(() -> service.respondToInvitation("box-1", "user-1", true))
        .isInstanceOf(InvalidBoxOperationException.class)
        .hasMessage("No pending invitation found for this box");
    assertThatThrownBy(() -> service.respondToInvitation("box-1", "stranger", true))
        .isInstanceOf(InvalidBoxOperationException.class);
  }

  @Test
  void concurrentViewsOfDistinctInvitationsAllLand() throws Exception {
    final int guardians = 8;
    final List<Guardian> initial = new ArrayList<>();
    for (int i = 0; i < guardians; i++) {
      initial.add(invited("placeholder-" + i, "inv-" + i, false));
    }
    repository.create(box("box-1", initial.toArray(new Guardian[0])));

    final ExecutorService pool = Executors.newFixedThreadPool(guardians);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<BoxRecord>> results = new ArrayList<>();
    try {
      for (int i = 0; i < guardians; i++) {
        final int index = i;
        results.add(
            pool.submit(
                () -> {
                  start.await();
                  return service.markViewed("box-1", "inv-" + index, "user-" + index);
                }));
      }
      start.countDown();
      for (Future<BoxRecord> result : results) {
        result.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    final BoxRecord stored = repository.findById("box-1").orElseThrow();
    assertThat(stored.version()).isEqualTo(guardians);
    for (int i = 0; i < guardians; i++) {
      final Guardian guardian = stored.findGuardianByInvitationId("inv-" + i).orElseThrow();
      assertThat(guardian.id()).isEqualTo("user-" + i);
      assertThat(guardian.status()).isEqualTo(GuardianStatus.VIEWED);
    }
  }
}
