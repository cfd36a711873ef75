/*
 * どこで: Box API 入力 DTO
 * 何を: PATCH /v1/boxes/owned/{id} の部分更新入力を保持する
 * なぜ: unlockInstructions の「未指定」と「null による削除」を区別するため
 */
package com.example.lockbox.box.api.request;

import com.example.lockbox.box.service.BoxDetailsPatch;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record UpdateBoxRequest(
    String name,
    String description,
    @JsonProperty("isLocked") Boolean isLocked,
    JsonNode unlockInstructions) {

  public BoxDetailsPatch toPatch() {
    if (unlockInstructions == null) {
      return new BoxDetailsPatch(name, description, isLocked, null, false);
    }
    if (unlockInstructions.isNull()) {
      return new BoxDetailsPatch(name, description, isLocked, null, true);
    }
    if (!unlockInstructions.isTextual()) {
      throw new IllegalArgumentException("unlockInstructions must be a string or null");
    }
    return new BoxDetailsPatch(name, description, isLocked, unlockInstructions.asText(), false);
  }
}
