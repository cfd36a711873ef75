/*
 * どこで: Box データアクセスの境界
 * 何を: version 付き Box 集約の取得/作成/条件付き更新/削除を定義する
 * なぜ: 永続化方式(PostgreSQL/インメモリ)に依存せず楽観的排他の契約を共有するため
 */
package com.example.lockbox.box.repository;

import com.example.lockbox.box.model.BoxRecord;
import java.util.List;
import java.util.Optional;

public interface BoxRepository {

  Optional<BoxRecord> findById(String id);

  List<BoxRecord> findByOwnerId(String ownerId);

  /** rejected を含め、指定ユーザーを guardians に持つ Box を返す。 */
  List<BoxRecord> findByGuardianId(String userId);

  /**
   * version 0 の新規 Box を保存する。
   *
   * @throws BoxStoreException 同じ id が既に存在する場合
   */
  BoxRecord create(BoxRecord box);

  /**
   * 集約全体を compare-and-swap で書き戻す。保存済み version が {@code box.version()} と一致する
   * 場合だけ受理し、version + 1 と更新日時を採番した集約を返す。
   *
   * @throws VersionConflictException 読み取り後に他の書き込みがコミットされていた場合
   * @throws BoxNotFoundException Box が存在しない場合
   */
  BoxRecord update(BoxRecord box);

  /**
   * @throws BoxNotFoundException Box が存在しない場合
   */
  void delete(String id);
}
