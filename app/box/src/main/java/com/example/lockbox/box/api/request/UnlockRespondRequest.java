/*
 * どこで: Box API 入力 DTO
 * 何を: PATCH /v1/boxes/guardian/{id}/respond の投票入力を保持する
 * なぜ: approve/reject のどちらか一方だけを受け付けるため(判定はサービス層)
 */
package com.example.lockbox.box.api.request;

public record UnlockRespondRequest(Boolean approve, Boolean reject) {

  public boolean approved() {
    return Boolean.TRUE.equals(approve);
  }

  public boolean rejected() {
    return Boolean.TRUE.equals(reject);
  }
}
