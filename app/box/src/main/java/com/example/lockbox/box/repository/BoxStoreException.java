/*
 * どこで: Box データアクセス
 * 何を: 永続化/シリアライズ失敗など内部エラーを表す
 * なぜ: 再試行対象の競合と区別し、呼び出し元へそのまま伝播させるため
 */
package com.example.lockbox.box.repository;

public class BoxStoreException extends RuntimeException {

  public BoxStoreException(String message) {
    super(message);
  }

  public BoxStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
