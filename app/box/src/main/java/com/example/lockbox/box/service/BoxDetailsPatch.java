package com.example.lockbox.box.service;

import com.example.lockbox.box.model.BoxRecord;

/**
 * オーナーによる Box 基本情報の部分更新。null のフィールドは変更しない。
 *
 * <p>unlockInstructions だけは「未指定」と「明示的な削除」を区別するため {@code clearUnlockInstructions} を持つ。
 */
public record BoxDetailsPatch(
    String name,
    String description,
    Boolean isLocked,
    String unlockInstructions,
    boolean clearUnlockInstructions) {

  public BoxRecord applyTo(BoxRecord box) {
    final String instructions;
    if (clearUnlockInstructions) {
      instructions = null;
    } else if (unlockInstructions != null) {
      instructions = unlockInstructions;
    } else {
      instructions = box.unlockInstructions();
    }
    return box.withDetails(
        name != null ? name : box.name(),
        description != null ? description : box.description(),
        isLocked != null ? isLocked : box.isLocked(),
        instructions);
  }
}
