/*
 * どこで: Box ドメインモデル
 * 何を: Box を共同管理するガーディアン1名分のスナップショットと状態遷移を表す
 * なぜ: 招待ライフサイクルの遷移を純粋関数として集約し、再試行で安全に再計算できるようにするため
 */
package com.example.lockbox.box.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Objects;

@JsonPropertyOrder({"id", "invitationId", "name", "email", "leadGuardian", "status", "addedAt"})
public record Guardian(
    @JsonIgnore GuardianIdentity identity,
    String invitationId,
    String name,
    String email,
    boolean leadGuardian,
    GuardianStatus status,
    Instant addedAt) {

  public Guardian {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(invitationId, "invitationId");
    Objects.requireNonNull(status, "status");
    // invited の間だけ仮 ID を許し、それ以外は必ず確定 ID を持たせる
    if ((status == GuardianStatus.INVITED) != (identity instanceof GuardianIdentity.Pending)) {
      throw new IllegalArgumentException(
          "guardian identity does not match status: invitationId="
              + invitationId
              + " status="
              + status.wireValue());
    }
  }

  @JsonCreator
  public static Guardian fromJson(
      @JsonProperty("id") String id,
      @JsonProperty("invitationId") String invitationId,
      @JsonProperty("name") String name,
      @JsonProperty("email") String email,
      @JsonProperty("leadGuardian") boolean leadGuardian,
      @JsonProperty("status") GuardianStatus status,
      @JsonProperty("addedAt") Instant addedAt) {
    final GuardianStatus resolvedStatus = status == null ? GuardianStatus.INVITED : status;
    return new Guardian(
        GuardianIdentity.of(id, resolvedStatus),
        invitationId,
        name,
        email,
        leadGuardian,
        resolvedStatus,
        addedAt);
  }

  public static Guardian invite(
      String placeholderId,
      String invitationId,
      String name,
      String email,
      boolean leadGuardian,
      Instant addedAt) {
    return new Guardian(
        new GuardianIdentity.Pending(placeholderId),
        invitationId,
        name,
        email,
        leadGuardian,
        GuardianStatus.INVITED,
        addedAt);
  }

  @JsonProperty("id")
  public String id() {
    return identity.value();
  }

  public boolean hasId(String userId) {
    return identity.value().equals(userId);
  }

  /** rejected 以外のガーディアンだけが Box の閲覧/投票に参加できる。 */
  @JsonIgnore
  public boolean isActive() {
    return status != GuardianStatus.REJECTED;
  }

  public Guardian markViewed(String userId) {
    return new Guardian(
        new GuardianIdentity.Resolved(userId),
        invitationId,
        name,
        email,
        leadGuardian,
        GuardianStatus.VIEWED,
        addedAt);
  }

  public Guardian respond(boolean accept) {
    if (!status.isAwaitingResponse()) {
      throw new IllegalStateException(
          "guardian is not awaiting a response: invitationId=" + invitationId);
    }
    return new Guardian(
        new GuardianIdentity.Resolved(identity.value()),
        invitationId,
        name,
        email,
        leadGuardian,
        accept ? GuardianStatus.ACCEPTED : GuardianStatus.REJECTED,
        addedAt);
  }

  /** オーナー更新では識別子/状態/追加日時を保ち、プロフィールだけを差し替える。 */
  public Guardian withProfile(String name, String email, boolean leadGuardian) {
    return new Guardian(identity, invitationId, name, email, leadGuardian, status, addedAt);
  }
}
