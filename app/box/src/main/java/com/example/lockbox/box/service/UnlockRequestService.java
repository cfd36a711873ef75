/*
 * どこで: Box サービス層(解錠リクエスト)
 * 何を: リードガーディアンによる解錠リクエストの開始とガーディアンの投票を扱う
 * なぜ: 投票の重複や取りこぼしなく、承認/拒否を Box 集約へ反映するため
 */
package com.example.lockbox.box.service;

import com.example.lockbox.box.model.BoxRecord;
import com.example.lockbox.box.model.Guardian;
import com.example.lockbox.box.model.UnlockRequest;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UnlockRequestService {

  private static final Logger logger = LoggerFactory.getLogger(UnlockRequestService.class);

  private final BoxUpdateExecutor updateExecutor;
  private final Clock clock;

  /** 既存のリクエストがあれば新しいリクエストで置き換える。 */
  public BoxRecord initiate(String boxId, String userId, String message) {
    return updateExecutor.execute(boxId, current -> initiateTransition(current, userId, message));
  }

  /**
   * 承認または拒否のどちらか一方を投票する。以前と逆の投票はもう一方の集合から移す。
   *
   * @throws InvalidBoxOperationException 両方/どちらも指定されていない、または同じ投票が記録済みの場合
   */
  public BoxRecord respond(String boxId, String userId, boolean approve, boolean reject) {
    if (approve && reject) {
      throw new InvalidBoxOperationException("approve and reject cannot both be set");
    }
    if (!approve && !reject) {
      throw new InvalidBoxOperationException("No valid update field provided");
    }
    return updateExecutor.execute(
        boxId,
        current -> voteTransition(current, userId, approve),
        latest -> hasVoted(latest, userId, approve));
  }

  private Optional<BoxRecord> initiateTransition(
      BoxRecord current, String userId, String message) {
    final Guardian guardian = requireActiveGuardian(current, userId);
    if (!guardian.leadGuardian()) {
      throw new InvalidBoxOperationException("Only lead guardians can initiate unlock requests");
    }
    final UnlockRequest existing = current.unlockRequest();
    if (existing != null) {
      logger.info(
          "replacing existing unlock request box_id={} previous_request_id={} initiated_by={}",
          current.id(),
          existing.id(),
          userId);
    }
    final UnlockRequest request =
        UnlockRequest.open(UUID.randomUUID().toString(), Instant.now(clock), message, userId);
    return Optional.of(current.withUnlockRequest(request));
  }

  private Optional<BoxRecord> voteTransition(BoxRecord current, String userId, boolean approve) {
    requireActiveGuardian(current, userId);
    final UnlockRequest request = current.unlockRequest();
    if (request == null) {
      throw new InvalidBoxOperationException("No unlock request exists for this box");
    }
    if (approve ? request.hasApproved(userId) : request.hasRejected(userId)) {
      throw new InvalidBoxOperationException("No valid update field provided");
    }
    final UnlockRequest voted =
        approve ? request.withApproval(userId) : request.withRejection(userId);
    return Optional.of(current.withUnlockRequest(voted));
  }

  private static Guardian requireActiveGuardian(BoxRecord box, String userId) {
    return box.findActiveGuardian(userId)
        .orElseThrow(
            () -> new BoxAccessDeniedException("user is not a guardian of this box: " + userId));
  }

  private static boolean hasVoted(BoxRecord box, String userId, boolean approve) {
    final UnlockRequest request = box.unlockRequest();
    if (request == null) {
      return false;
    }
    return approve ? request.hasApproved(userId) : request.hasRejected(userId);
  }
}
