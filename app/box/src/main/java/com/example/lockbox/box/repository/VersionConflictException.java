/*
 * どこで: Box データアクセス
 * 何を: 楽観的排他の version 不一致を表す例外
 * なぜ: 再試行すべき一時的な競合を他の失敗と型で区別するため
 */
package com.example.lockbox.box.repository;

public class VersionConflictException extends RuntimeException {

  private final String boxId;
  private final long expectedVersion;

  public VersionConflictException(String boxId, long expectedVersion) {
    super("box version conflict: box_id=" + boxId + " expected_version=" + expectedVersion);
    this.boxId = boxId;
    this.expectedVersion = expectedVersion;
  }

  public String boxId() {
    return boxId;
  }

  public long expectedVersion() {
    return expectedVersion;
  }
}
