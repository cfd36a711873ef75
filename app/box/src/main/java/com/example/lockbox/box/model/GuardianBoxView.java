/*
 * どこで: Box ドメインモデル(読み取り用)
 * 何を: ガーディアンから見た Box の要約を表す
 * なぜ: 文書やほかのガーディアンの連絡先を見せず、判断に必要な情報だけを返すため
 */
package com.example.lockbox.box.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record GuardianBoxView(
    String id,
    String name,
    String description,
    @JsonProperty("isLocked") boolean isLocked,
    Instant createdAt,
    Instant updatedAt,
    String ownerId,
    String ownerName,
    String unlockInstructions,
    UnlockRequest unlockRequest,
    boolean pendingGuardianApproval,
    int guardiansCount,
    @JsonProperty("isLeadGuardian") boolean isLeadGuardian) {

  public static GuardianBoxView of(BoxRecord box, Guardian viewer) {
    return new GuardianBoxView(
        box.id(),
        box.name(),
        box.description(),
        box.isLocked(),
        box.createdAt(),
        box.updatedAt(),
        box.ownerId(),
        box.ownerName(),
        box.unlockInstructions(),
        box.unlockRequest(),
        viewer.status().isAwaitingResponse(),
        box.guardians().size(),
        viewer.leadGuardian());
  }
}
