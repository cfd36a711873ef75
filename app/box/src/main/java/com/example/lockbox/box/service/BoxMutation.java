package com.example.lockbox.box.service;

import com.example.lockbox.box.model.BoxRecord;
import java.util.Optional;

/**
 * 読み取った Box から書き込む Box を計算する純粋関数。競合のたびに最新の Box で再実行されるため、
 * ストアへの書き込み以外の副作用を持ってはならない。
 */
@FunctionalInterface
public interface BoxMutation {

  /**
   * @return 書き込む Box。変更不要(既に適用済み)なら空
   */
  Optional<BoxRecord> apply(BoxRecord current);
}
