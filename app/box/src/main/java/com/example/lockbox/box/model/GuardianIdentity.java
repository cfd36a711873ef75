/*
 * どこで: Box ドメインモデル
 * 何を: ガーディアンの識別子を「招待中の仮 ID」と「確定したユーザー ID」の2種で表す
 * なぜ: 招待閲覧時の ID 差し替えを文字列比較ではなく型で扱うため
 */
package com.example.lockbox.box.model;

import java.util.Objects;

public sealed interface GuardianIdentity
    permits GuardianIdentity.Pending, GuardianIdentity.Resolved {

  /** 永続化/JSON 上の {@code id} として使う値。 */
  String value();

  /**
   * 永続化された {@code id} と状態から識別子を復元する。invited の間だけ仮 ID とみなす。
   */
  static GuardianIdentity of(String id, GuardianStatus status) {
    if (status == GuardianStatus.INVITED) {
      return new Pending(id);
    }
    return new Resolved(id);
  }

  /** オーナーが招待時に割り当てた仮 ID。招待が閲覧されるまで使われる。 */
  record Pending(String placeholderId) implements GuardianIdentity {
    public Pending {
      Objects.requireNonNull(placeholderId, "placeholderId");
    }

    @Override
    public String value() {
      return placeholderId;
    }
  }

  /** 招待を開いた実ユーザーの ID。 */
  record Resolved(String userId) implements GuardianIdentity {
    public Resolved {
      Objects.requireNonNull(userId, "userId");
    }

    @Override
    public String value() {
      return userId;
    }
  }
}
