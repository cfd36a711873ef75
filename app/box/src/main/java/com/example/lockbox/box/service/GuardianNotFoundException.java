/*
 * どこで: Box サービス層
 * 何を: Box 内に対象ガーディアンがいないことを表す
 * なぜ: 再試行しない失敗として 404 応答に変換するため
 */
package com.example.lockbox.box.service;

public class GuardianNotFoundException extends RuntimeException {

  public GuardianNotFoundException(String boxId, String guardianKey) {
    super("guardian not found: box_id=" + boxId + " guardian=" + guardianKey);
  }
}
