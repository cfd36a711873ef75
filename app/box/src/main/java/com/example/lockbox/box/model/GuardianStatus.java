/*
 * どこで: Box ドメインモデル
 * 何を: ガーディアン招待の状態を定義する
 * なぜ: invited -> viewed -> accepted/rejected の遷移を型で表現するため
 */
package com.example.lockbox.box.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GuardianStatus {
  INVITED("invited"),
  VIEWED("viewed"),
  ACCEPTED("accepted"),
  REJECTED("rejected");

  private final String wireValue;

  GuardianStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  /** 招待への承諾/拒否をまだ返していない状態か。 */
  public boolean isAwaitingResponse() {
    return this == INVITED || this == VIEWED;
  }

  @JsonCreator
  public static GuardianStatus fromWireValue(String value) {
    for (GuardianStatus status : values()) {
      if (status.wireValue.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown guardian status: " + value);
  }
}
