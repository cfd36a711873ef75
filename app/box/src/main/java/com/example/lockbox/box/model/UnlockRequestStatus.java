/*
 * どこで: Box ドメインモデル
 * 何を: 解錠リクエストの状態を定義する
 * なぜ: 初期状態を pending に統一して永続化と API で同じ値を使うため
 */
package com.example.lockbox.box.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UnlockRequestStatus {
  PENDING("pending");

  // 旧データは初期状態を "invited" で保存していたため読み取り時のみ pending に寄せる
  private static final String LEGACY_INITIAL_VALUE = "invited";

  private final String wireValue;

  UnlockRequestStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  @JsonCreator
  public static UnlockRequestStatus fromWireValue(String value) {
    if (LEGACY_INITIAL_VALUE.equalsIgnoreCase(value)) {
      return PENDING;
    }
    for (UnlockRequestStatus status : values()) {
      if (status.wireValue.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown unlock request status: " + value);
  }
}
