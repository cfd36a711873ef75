/*
 * どこで: Box サービス層
 * 何を: 現在の Box 状態では受け付けられない操作を表す
 * なぜ: 再試行しても成立しない入力/状態の不整合を 400 応答として返すため
 */
package com.example.lockbox.box.service;

public class InvalidBoxOperationException extends RuntimeException {

  public InvalidBoxOperationException(String message) {
    super(message);
  }
}
