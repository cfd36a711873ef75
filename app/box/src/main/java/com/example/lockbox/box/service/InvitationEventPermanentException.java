/*
 * どこで: Box サービス層(招待イベント)
 * 何を: 再配信しても回復しないイベントであることを表す
 * なぜ: Subscriber が TERM で再配信を打ち切る判断に使うため
 */
package com.example.lockbox.box.service;

public class InvitationEventPermanentException extends RuntimeException {

  public InvitationEventPermanentException(String message) {
    super(message);
  }

  public InvitationEventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
