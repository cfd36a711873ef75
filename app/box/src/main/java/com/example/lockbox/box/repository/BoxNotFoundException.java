/*
 * どこで: Box データアクセス
 * 何を: Box 未検出を表す
 * なぜ: 再試行しても回復しない失敗として 404 応答やイベント破棄に使うため
 */
package com.example.lockbox.box.repository;

public class BoxNotFoundException extends RuntimeException {

  public BoxNotFoundException(String boxId) {
    super("box not found: " + boxId);
  }
}
