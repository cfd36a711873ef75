package com.example.lockbox.box.service;

/** version 競合後、次の試行までの待機時間を決める。 */
@FunctionalInterface
public interface BackoffPolicy {

  /**
   * @param attempt これまでに競合した回数 (1 始まり)
   * @return 待機ミリ秒
   */
  long computeDelayMs(int attempt);
}
