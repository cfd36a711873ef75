/*
 * どこで: Box ドメインモデル
 * 何を: オーナー/ガーディアン/文書/解錠リクエストを束ねた Box 集約のスナップショットを表す
 * なぜ: 集約単位の楽観的排他(version)で読み取り-変更-書き込みを行うため
 */
package com.example.lockbox.box.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

public record BoxRecord(
    String id,
    long version,
    String name,
    String description,
    String ownerId,
    String ownerName,
    @JsonProperty("isLocked") boolean isLocked,
    String unlockInstructions,
    List<Document> documents,
    List<Guardian> guardians,
    UnlockRequest unlockRequest,
    Instant createdAt,
    Instant updatedAt) {

  public BoxRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ownerId, "ownerId");
    if (version < 0) {
      throw new IllegalArgumentException("version must be >= 0: " + version);
    }
    documents = documents == null ? List.of() : List.copyOf(documents);
    guardians = guardians == null ? List.of() : List.copyOf(guardians);
    requireUniqueGuardians(id, guardians);
  }

  public static BoxRecord create(
      String id,
      String ownerId,
      String ownerName,
      String name,
      String description,
      Instant now) {
    return new BoxRecord(
        id, 0L, name, description, ownerId, ownerName, false, null, List.of(), List.of(), null,
        now, now);
  }

  public boolean isOwnedBy(String userId) {
    return ownerId.equals(userId);
  }

  public Optional<Guardian> findGuardianByInvitationId(String invitationId) {
    return guardians.stream().filter(g -> g.invitationId().equals(invitationId)).findFirst();
  }

  public Optional<Guardian> findGuardianById(String guardianId) {
    return guardians.stream().filter(g -> g.hasId(guardianId)).findFirst();
  }

  /** rejected を除いたガーディアンとして userId を探す。 */
  public Optional<Guardian> findActiveGuardian(String userId) {
    return findGuardianById(userId).filter(Guardian::isActive);
  }

  public Optional<Document> findDocument(String documentId) {
    return documents.stream().filter(d -> d.id().equals(documentId)).findFirst();
  }

  /** invitationId を相関キーとしてガーディアンを置き換える。 */
  public BoxRecord withGuardianReplaced(String invitationId, UnaryOperator<Guardian> transition) {
    final List<Guardian> updated = new ArrayList<>(guardians.size());
    for (Guardian guardian : guardians) {
      updated.add(
          guardian.invitationId().equals(invitationId) ? transition.apply(guardian) : guardian);
    }
    return withGuardians(updated);
  }

  public BoxRecord withGuardians(List<Guardian> newGuardians) {
    return new BoxRecord(
        id, version, name, description, ownerId, ownerName, isLocked, unlockInstructions,
        documents, newGuardians, unlockRequest, createdAt, updatedAt);
  }

  public BoxRecord withDocuments(List<Document> newDocuments) {
    return new BoxRecord(
        id, version, name, description, ownerId, ownerName, isLocked, unlockInstructions,
        newDocuments, guardians, unlockRequest, createdAt, updatedAt);
  }

  public BoxRecord withUnlockRequest(UnlockRequest newUnlockRequest) {
    return new BoxRecord(
        id, version, name, description, ownerId, ownerName, isLocked, unlockInstructions,
        documents, guardians, newUnlockRequest, createdAt, updatedAt);
  }

  public BoxRecord withDetails(
      String newName, String newDescription, boolean newIsLocked, String newUnlockInstructions) {
    return new BoxRecord(
        id, version, newName, newDescription, ownerId, ownerName, newIsLocked,
        newUnlockInstructions, documents, guardians, unlockRequest, createdAt, updatedAt);
  }

  /** ストアがコミット時に採番した version と更新日時を反映する。 */
  public BoxRecord withCommit(long newVersion, Instant newUpdatedAt) {
    return new BoxRecord(
        id, newVersion, name, description, ownerId, ownerName, isLocked, unlockInstructions,
        documents, guardians, unlockRequest, createdAt, newUpdatedAt);
  }

  private static void requireUniqueGuardians(String boxId, List<Guardian> guardians) {
    final Set<String> ids = new HashSet<>();
    final Set<String> invitationIds = new HashSet<>();
    for (Guardian guardian : guardians) {
      if (!ids.add(guardian.id())) {
        throw new IllegalArgumentException(
            "duplicate guardian id in box " + boxId + ": " + guardian.id());
      }
      if (!invitationIds.add(guardian.invitationId())) {
        throw new IllegalArgumentException(
            "duplicate guardian invitationId in box " + boxId + ": " + guardian.invitationId());
      }
    }
  }
}
