/*
 * どこで: Box アプリのサービス設定
 * 何を: 再試行制御が使うバックオフ方針と待機手段を Bean 化する
 * なぜ: テストで待機を差し替えられるようにしつつ、本番は設定値どおりに待つため
 */
package com.example.lockbox.box.config;

import com.example.lockbox.box.service.BackoffPolicy;
import com.example.lockbox.box.service.ExponentialJitterBackoffPolicy;
import com.example.lockbox.box.service.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BoxRetryConfig {

  @Bean
  public BackoffPolicy boxBackoffPolicy(BoxRetryProperties properties) {
    return new ExponentialJitterBackoffPolicy(
        properties.baseDelayMs(), properties.multiplier(), properties.maxJitterMs());
  }

  @Bean
  public Sleeper boxRetrySleeper() {
    return Sleeper.THREAD_SLEEP;
  }
}
