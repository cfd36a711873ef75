/*
 * どこで: Box オーナー操作/ガーディアン参照のテスト
 * 何を: オーナー権限の確認、ガーディアン/文書の追加更新削除、ガーディアン向けビューを検証する
 * なぜ: オーナー操作がガーディアンの状態を壊さず、権限のない呼び出しを拒否することを保証するため
 */
package com.example.lockbox.box.service;

import static com.example.lockbox.box.BoxFixtures.CLOCK;
import static com.example.lockbox.box.BoxFixtures.NOW;
import static com.example.lockbox.box.BoxFixtures.OWNER_ID;
import static com.example.lockbox.box.BoxFixtures.accepted;
import static com.example.lockbox.box.BoxFixtures.box;
import static com.example.lockbox.box.BoxFixtures.executor;
import static com.example.lockbox.box.BoxFixtures.invited;
import static com.example.lockbox.box.BoxFixtures.withStatus;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.lockbox.box.model.BoxRecord;
import com.example.lockbox.box.model.Guardian;
import com.example.lockbox.box.model.GuardianBoxView;
import com.example.lockbox.box.model.GuardianIdentity;
import com.example.lockbox.box.model.GuardianStatus;
import com.example.lockbox.box.repository.BoxNotFoundException;
import com.example.lockbox.box.repository.InMemoryBoxRepository;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BoxServiceTest {

  private InMemoryBoxRepository repository;
  private BoxService service;

  @BeforeEach
  void setUp() {
    repository = new InMemoryBoxRepository(CLOCK);
    service = new BoxService(repository, executor(repository), CLOCK);
  }

  @Test
  void createBoxStartsAtVersionZeroForOwner() {
    final BoxRecord created = service.createBox(OWNER_ID, "Owner", "vault", "desc");

    assertThat(created.version()).isZero();
    assertThat(created.ownerId()).isEqualTo(OWNER_ID);
    assertThat(service.listOwnedBoxes(OWNER_ID)).extracting(BoxRecord::id).containsExactly(created.id());
    assertThat(service.getOwnedBox(created.id(), OWNER_ID)).isEqualTo(created);
  }

  @Test
  void nonOwnerCannotReadOrChangeBox() {
    repository.create(box("box-1"));

    assertThatThrownBy(() -> service.getOwnedBox("box-1", "intruder"))
        .isInstanceOf(BoxAccessDeniedException.class);
    assertThatThrownBy(
            () -> service.updateBox("box-1", "intruder", new BoxDetailsPatch("x", null, null, null, false)))
        .isInstanceOf(BoxAccessDeniedException.class);
    assertThatThrownBy(() -> service.deleteBox("box-1", "intruder"))
        .isInstanceOf(BoxAccessDeniedException.class);
    assertThat(repository.findById("box-1").orElseThrow().version()).isZero();
  }

  @Test
  void updateBoxAppliesOnlyProvidedFields() {
    repository.create(box("box-1"));

    final BoxRecord locked =
        service.updateBox("box-1", OWNER_ID, new BoxDetailsPatch(null, null, true, "call me", false));

    assertThat(locked.isLocked()).isTrue();
    assertThat(locked.name()).isEqualTo("Family vault");
    assertThat(locked.unlockInstructions()).isEqualTo("call me");

    final BoxRecord cleared =
        service.updateBox("box-1", OWNER_ID, new BoxDetailsPatch("renamed", null, null, null, true));

    assertThat(cleared.name()).isEqualTo("renamed");
    assertThat(cleared.isLocked()).isTrue();
    assertThat(cleared.unlockInstructions()).isNull();
    assertThat(cleared.version()).isEqualTo(2L);
  }

  @Test
  void updateWithoutChangesDoesNotWrite() {
    repository.create(box("box-1"));

    final BoxRecord result =
        service.updateBox("box-1", OWNER_ID, new BoxDetailsPatch(null, null, null, null, false));

    assertThat(result.version()).isZero();
  }

  @Test
  void upsertGuardianAddsInvitedGuardian() {
    repository.create(box("box-1"));

    final BoxRecord updated =
        service.upsertGuardian("box-1", OWNER_ID, "placeholder", "inv-1", "Ann", "ann@example.com", true);

    final Guardian guardian = updated.findGuardianByInvitationId("inv-1").orElseThrow();
    assertThat(guardian.identity()).isEqualTo(new GuardianIdentity.Pending("placeholder"));
    assertThat(guardian.status()).isEqualTo(GuardianStatus.INVITED);
    assertThat(guardian.leadGuardian()).isTrue();
    assertThat(guardian.addedAt()).isEqualTo(NOW);
  }

  @Test
  void upsertGuardianKeepsStatusOfExistingGuardian() {
    repository.create(box("box-1", withStatus("user-1", "inv-1", GuardianStatus.VIEWED, false)));

    final BoxRecord updated =
        service.upsertGuardian("box-1", OWNER_ID, "ignored", "inv-1", "Renamed", "r@example.com", true);

    final Guardian guardian = updated.findGuardianByInvitationId("inv-1").orElseThrow();
    assertThat(guardian.id()).isEqualTo("user-1");
    assertThat(guardian.status()).isEqualTo(GuardianStatus.VIEWED);
    assertThat(guardian.name()).isEqualTo("Renamed");
    assertThat(guardian.leadGuardian()).isTrue();
    assertThat(updated.guardians()).hasSize(1);
  }

  @Test
  void upsertGuardianRejectsCollidingId() {
    repository.create(box("box-1", accepted("user-1", "inv-1", false)));

    assertThatThrownBy(
            () -> service.upsertGuardian("box-1", OWNER_ID, "user-1", "inv-2", "B", "b@example.com", false))
        .isInstanceOf(InvalidBoxOperationException.class);
  }

  @Test
  void deleteGuardianRemovesOnlyThatGuardian() {
    repository.create(box("box-1", accepted("user-1", "inv-1", false), invited("p-2", "inv-2", false)));

    final BoxRecord updated = service.deleteGuardian("box-1", OWNER_ID, "user-1");

    assertThat(updated.guardians()).extracting(Guardian::id).containsExactly("p-2");
    assertThatThrownBy(() -> service.deleteGuardian("box-1", OWNER_ID, "user-1"))
        .isInstanceOf(GuardianNotFoundException.class);
  }

  @Test
  void upsertDocumentKeepsCreationTimeOnReplace() {
    repository.create(box("box-1"));

    service.upsertDocument("box-1", OWNER_ID, "doc-1", "Will", "v1");
    final BoxRecord updated = service.upsertDocument("box-1", OWNER_ID, "doc-1", "Will", "v2");

    assertThat(updated.documents()).hasSize(1);
    assertThat(updated.findDocument("doc-1").orElseThrow().content()).isEqualTo("v2");
    assertThat(updated.findDocument("doc-1").orElseThrow().createdAt()).isEqualTo(NOW);
  }

  @Test
  void deleteMissingDocumentIsNotFound() {
    repository.create(box("box-1"));

    assertThatThrownBy(() -> service.deleteDocument("box-1", OWNER_ID, "doc-x"))
        .isInstanceOf(DocumentNotFoundException.class);
  }

  @Test
  void deletedBoxCanNoLongerBeChanged() {
    repository.create(box("box-1"));

    service.deleteBox("box-1", OWNER_ID);

    assertThatThrownBy(() -> service.getOwnedBox("box-1", OWNER_ID))
        .isInstanceOf(BoxNotFoundException.class);
    assertThatThrownBy(
            () -> service.updateBox("box-1", OWNER_ID, new BoxDetailsPatch("x", null, null, null, false)))
        .isInstanceOf(BoxNotFoundException.class);
  }

  @Test
  void guardianViewsHideRejectedMembership() {
    repository.create(
        box(
            "box-1",
            withStatus("user-1", "inv-1", GuardianStatus.VIEWED, true),
            withStatus("user-2", "inv-2", GuardianStatus.REJECTED, false)));

    final List<GuardianBoxView> views = service.listGuardianBoxes("user-1");

    assertThat(views).hasSize(1);
    final GuardianBoxView view = views.get(0);
    assertThat(view.pendingGuardianApproval()).isTrue();
    assertThat(view.isLeadGuardian()).isTrue();
    assertThat(view.guardiansCount()).isEqualTo(2);
    assertThat(service.listGuardianBoxes("user-2")).isEmpty();
    assertThatThrownBy(() -> service.getGuardianBox("box-1", "user-2"))
        .isInstanceOf(BoxAccessDeniedException.class);
  }
}
