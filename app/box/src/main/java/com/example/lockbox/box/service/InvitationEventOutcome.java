package com.example.lockbox.box.service;

/** 招待イベント1件の処理結果。 */
public enum InvitationEventOutcome {
  /** Box に変更を反映した(または既に反映済みだった)。 */
  APPLIED,
  /** 対象が存在しない/処理対象外のため何もしなかった。 */
  IGNORED
}
