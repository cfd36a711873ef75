package com.example.lockbox.box.service;

import java.time.Duration;

/** 再試行間の待機。ロックを保持したまま呼ばないこと。 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
