/*
 * どこで: Box サービス層(ガーディアン招待ライフサイクル)
 * 何を: 招待の閲覧と招待への応答を、再試行制御の下でガーディアン状態へ反映する
 * なぜ: 同じ Box に複数のイベント/操作が同時に届いても遷移を失わず、再送にも冪等にするため
 */
package com.example.lockbox.box.service;

import com.example.lockbox.box.model.BoxRecord;
import com.example.lockbox.box.model.Guardian;
import com.example.lockbox.box.model.GuardianStatus;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GuardianLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(GuardianLifecycleService.class);

  private final BoxUpdateExecutor updateExecutor;

  /**
   * invitationId で特定したガーディアンを、招待を開いたユーザーの ID で viewed にする。
   *
   * <p>同じユーザーで既に viewed なら書き込まずに成功する。invitationId に対応するガーディアンがいない場合と、
   * invited 以外の状態のガーディアンは変更しない。
   *
   * @throws InvalidBoxOperationException userId が同じ Box の別ガーディアンに使われている場合
   */
  public BoxRecord markViewed(String boxId, String invitationId, String userId) {
    return updateExecutor.execute(
        boxId,
        current -> markViewedTransition(current, invitationId, userId),
        latest -> isViewedBy(latest, invitationId, userId));
  }

  /**
   * userId のガーディアンとして招待を承諾/辞退する。
   *
   * @throws InvalidBoxOperationException 応答待ちの招待がない場合
   */
  public BoxRecord respondToInvitation(String boxId, String userId, boolean accept) {
    final GuardianStatus target = accept ? GuardianStatus.ACCEPTED : GuardianStatus.REJECTED;
    final BoxRecord updated =
        updateExecutor.execute(
            boxId,
            current -> respondTransition(current, userId, accept),
            latest ->
                latest
                    .findGuardianById(userId)
                    .map(g -> g.status() == target)
                    .orElse(false));
    logger.info(
        "guardian responded to invitation box_id={} user_id={} status={}",
        boxId,
        userId,
        target.wireValue());
    return updated;
  }

  private Optional<BoxRecord> markViewedTransition(
      BoxRecord current, String invitationId, String userId) {
    final Optional<Guardian> found = current.findGuardianByInvitationId(invitationId);
    if (found.isEmpty()) {
      logger.warn(
          "no guardian for invitation, view ignored box_id={} invitation_id={}",
          current.id(),
          invitationId);
      return Optional.empty();
    }
    final Guardian guardian = found.get();
    if (guardian.status() == GuardianStatus.VIEWED && guardian.hasId(userId)) {
      return Optional.empty();
    }
    if (guardian.status() != GuardianStatus.INVITED) {
      logger.info(
          "guardian not in invited status, view ignored box_id={} invitation_id={} status={}",
          current.id(),
          invitationId,
          guardian.status().wireValue());
      return Optional.empty();
    }
    final boolean takenByOther =
        current.guardians().stream()
            .anyMatch(g -> !g.invitationId().equals(invitationId) && g.hasId(userId));
    if (takenByOther) {
      throw new InvalidBoxOperationException(
          "user is already a guardian of this box: user_id=" + userId);
    }
    return Optional.of(current.withGuardianReplaced(invitationId, g -> g.markViewed(userId)));
  }

  private Optional<BoxRecord> respondTransition(
      BoxRecord current, String userId, boolean accept) {
    final Guardian guardian =
        current
            .findGuardianById(userId)
            .filter(g -> g.status().isAwaitingResponse())
            .orElseThrow(
                () -> new InvalidBoxOperationException("No pending invitation found for this box"));
    return Optional.of(
        current.withGuardianReplaced(guardian.invitationId(), g -> g.respond(accept)));
  }

  private static boolean isViewedBy(BoxRecord box, String invitationId, String userId) {
    return box.findGuardianByInvitationId(invitationId)
        .map(g -> g.status() == GuardianStatus.VIEWED && g.hasId(userId))
        .orElse(false);
  }
}
