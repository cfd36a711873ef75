/*
 * どこで: Box サービス層(オーナー操作とガーディアン向け参照)
 * 何を: Box の作成/更新/削除、ガーディアンと文書の追加更新削除、ガーディアン向けの一覧/詳細を提供する
 * なぜ: オーナー操作もイベント処理と同じ再試行制御を通し、同時更新で変更を失わないようにするため
 */
package com.example.lockbox.box.service;

import com.example.lockbox.box.model.BoxRecord;
import com.example.lockbox.box.model.Document;
import com.example.lockbox.box.model.Guardian;
import com.example.lockbox.box.model.GuardianBoxView;
import com.example.lockbox.box.repository.BoxNotFoundException;
import com.example.lockbox.box.repository.BoxRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BoxService {

  private static final Logger logger = LoggerFactory.getLogger(BoxService.class);

  private final BoxRepository boxRepository;
  private final BoxUpdateExecutor updateExecutor;
  private final Clock clock;

  public BoxRecord createBox(String ownerId, String ownerName, String name, String description) {
    final BoxRecord box =
        BoxRecord.create(
            UUID.randomUUID().toString(), ownerId, ownerName, name, description, Instant.now(clock));
    final BoxRecord created = boxRepository.create(box);
    logger.info("box created box_id={} owner_id={}", created.id(), ownerId);
    return created;
  }

  public List<BoxRecord> listOwnedBoxes(String ownerId) {
    return boxRepository.findByOwnerId(ownerId);
  }

  public BoxRecord getOwnedBox(String boxId, String userId) {
    final BoxRecord box = load(boxId);
    requireOwner(box, userId);
    return box;
  }

  public BoxRecord updateBox(String boxId, String userId, BoxDetailsPatch patch) {
    return ownerUpdate(boxId, userId, patch::applyTo);
  }

  public void deleteBox(String boxId, String userId) {
    requireOwner(load(boxId), userId);
    boxRepository.delete(boxId);
    logger.info("box deleted box_id={} owner_id={}", boxId, userId);
  }

  /**
   * invitationId が一致するガーディアンがいればプロフィールだけを更新し、いなければ invited として追加する。
   *
   * @param guardianId 新規追加時の仮 ID。null なら採番する
   */
  public BoxRecord upsertGuardian(
      String boxId,
      String userId,
      String guardianId,
      String invitationId,
      String name,
      String email,
      boolean leadGuardian) {
    final String placeholderId = guardianId != null ? guardianId : UUID.randomUUID().toString();
    return ownerUpdate(
        boxId,
        userId,
        current -> {
          if (current.findGuardianByInvitationId(invitationId).isPresent()) {
            return current.withGuardianReplaced(
                invitationId, g -> g.withProfile(name, email, leadGuardian));
          }
          if (current.findGuardianById(placeholderId).isPresent()) {
            throw new InvalidBoxOperationException(
                "guardian id already exists in this box: " + placeholderId);
          }
          final List<Guardian> guardians = new ArrayList<>(current.guardians());
          guardians.add(
              Guardian.invite(
                  placeholderId, invitationId, name, email, leadGuardian, Instant.now(clock)));
          return current.withGuardians(guardians);
        });
  }

  public BoxRecord deleteGuardian(String boxId, String userId, String guardianId) {
    return ownerUpdate(
        boxId,
        userId,
        current -> {
          final Guardian target =
              current
                  .findGuardianById(guardianId)
                  .orElseThrow(() -> new GuardianNotFoundException(boxId, guardianId));
          final List<Guardian> guardians = new ArrayList<>(current.guardians());
          guardians.remove(target);
          return current.withGuardians(guardians);
        });
  }

  /** id の文書が既存なら置き換え、なければ追加する。作成日時は初回のものを保つ。 */
  public BoxRecord upsertDocument(
      String boxId, String userId, String id, String title, String content) {
    return ownerUpdate(
        boxId,
        userId,
        current -> {
          final List<Document> documents = new ArrayList<>();
          boolean replaced = false;
          for (Document document : current.documents()) {
            if (document.id().equals(id)) {
              documents.add(new Document(id, title, content, document.createdAt()));
              replaced = true;
            } else {
              documents.add(document);
            }
          }
          if (!replaced) {
            documents.add(new Document(id, title, content, Instant.now(clock)));
          }
          return current.withDocuments(documents);
        });
  }

  public BoxRecord deleteDocument(String boxId, String userId, String documentId) {
    return ownerUpdate(
        boxId,
        userId,
        current -> {
          final Document target =
              current
                  .findDocument(documentId)
                  .orElseThrow(() -> new DocumentNotFoundException(boxId, documentId));
          final List<Document> documents = new ArrayList<>(current.documents());
          documents.remove(target);
          return current.withDocuments(documents);
        });
  }

  /** 呼び出し元が rejected 以外のガーディアンである Box の一覧。 */
  public List<GuardianBoxView> listGuardianBoxes(String userId) {
    final List<GuardianBoxView> views = new ArrayList<>();
    for (BoxRecord box : boxRepository.findByGuardianId(userId)) {
      box.findActiveGuardian(userId).ifPresent(g -> views.add(GuardianBoxView.of(box, g)));
    }
    return views;
  }

  public GuardianBoxView getGuardianBox(String boxId, String userId) {
    final BoxRecord box = load(boxId);
    final Guardian guardian =
        box.findActiveGuardian(userId)
            .orElseThrow(
                () -> new BoxAccessDeniedException("user is not a guardian of this box: " + userId));
    return GuardianBoxView.of(box, guardian);
  }

  /** 更新直後の Box を操作したガーディアンの視点で返す。rejected になった直後も含む。 */
  public GuardianBoxView toGuardianView(BoxRecord box, String userId) {
    final Guardian guardian =
        box.findGuardianById(userId)
            .orElseThrow(
                () -> new BoxAccessDeniedException("user is not a guardian of this box: " + userId));
    return GuardianBoxView.of(box, guardian);
  }

  private BoxRecord ownerUpdate(String boxId, String userId, UnaryOperator<BoxRecord> change) {
    return updateExecutor.execute(
        boxId,
        current -> {
          requireOwner(current, userId);
          final BoxRecord next = change.apply(current);
          return next.equals(current) ? Optional.empty() : Optional.of(next);
        });
  }

  private BoxRecord load(String boxId) {
    return boxRepository.findById(boxId).orElseThrow(() -> new BoxNotFoundException(boxId));
  }

  private static void requireOwner(BoxRecord box, String userId) {
    if (!box.isOwnedBy(userId)) {
      throw new BoxAccessDeniedException("user is not the owner of this box: " + userId);
    }
  }
}
