/*
 * どこで: Box サービス層
 * 何を: 呼び出し元がオーナー/有効なガーディアンでないことを表す
 * なぜ: 認可の失敗を入力不正と区別して 403 応答にするため
 */
package com.example.lockbox.box.service;

public class BoxAccessDeniedException extends RuntimeException {

  public BoxAccessDeniedException(String message) {
    super(message);
  }
}
