/*
 * どこで: Common 共通設定
 * 何を: ミリ秒単位に丸めた UTC の Clock を DI 可能にする
 * なぜ: Box の JSON 文書と updated_at 列で同じ精度の時刻を保存し、比較がずれないようにするため
 */
package com.example.lockbox.common.config;

import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.tick(Clock.systemUTC(), Duration.ofMillis(1));
  }
}
