/*
 * どこで: Box ドメインモデル
 * 何を: リードガーディアンが開始した解錠リクエストと投票状況を表す
 * なぜ: 承認/拒否の投票を集合として保持し、重複投票を構造的に防ぐため
 */
package com.example.lockbox.box.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

public record UnlockRequest(
    String id,
    Instant requestedAt,
    UnlockRequestStatus status,
    String message,
    String initiatedBy,
    List<String> approvedBy,
    List<String> rejectedBy) {

  public UnlockRequest {
    Objects.requireNonNull(id, "id");
    status = status == null ? UnlockRequestStatus.PENDING : status;
    // 集合として扱うため、重複を落として挿入順だけ保つ
    approvedBy = distinct(approvedBy);
    rejectedBy = distinct(rejectedBy);
  }

  public static UnlockRequest open(
      String id, Instant requestedAt, String message, String initiatedBy) {
    return new UnlockRequest(
        id, requestedAt, UnlockRequestStatus.PENDING, message, initiatedBy, List.of(), List.of());
  }

  public boolean hasApproved(String guardianId) {
    return approvedBy.contains(guardianId);
  }

  public boolean hasRejected(String guardianId) {
    return rejectedBy.contains(guardianId);
  }

  /** 承認へ投票する。拒否済みなら拒否側から外し、両方に残らないようにする。 */
  public UnlockRequest withApproval(String guardianId) {
    return new UnlockRequest(
        id,
        requestedAt,
        status,
        message,
        initiatedBy,
        append(approvedBy, guardianId),
        remove(rejectedBy, guardianId));
  }

  /** 拒否へ投票する。承認済みなら承認側から外す。 */
  public UnlockRequest withRejection(String guardianId) {
    return new UnlockRequest(
        id,
        requestedAt,
        status,
        message,
        initiatedBy,
        remove(approvedBy, guardianId),
        append(rejectedBy, guardianId));
  }

  private static List<String> distinct(List<String> values) {
    if (values == null) {
      return List.of();
    }
    return List.copyOf(new LinkedHashSet<>(values));
  }

  private static List<String> append(List<String> values, String value) {
    final List<String> copy = new ArrayList<>(values);
    if (!copy.contains(value)) {
      copy.add(value);
    }
    return copy;
  }

  private static List<String> remove(List<String> values, String value) {
    final List<String> copy = new ArrayList<>(values);
    copy.remove(value);
    return copy;
  }
}
