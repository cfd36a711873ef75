/*
 * どこで: Box アプリの設定バインド
 * 何を: version 競合時の再試行上限とバックオフ係数を保持する
 * なぜ: 競合の多い環境で再試行の強さを運用で調整し、起動時に妥当性を検証するため
 */
package com.example.lockbox.box.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "box.retry")
@Validated
public record BoxRetryProperties(
    @DefaultValue("10") @Positive int maxRetries,
    @DefaultValue("25") @Positive long baseDelayMs,
    @DefaultValue("1.5") @DecimalMin("1.0") double multiplier,
    @DefaultValue("20") @PositiveOrZero long maxJitterMs) {

  public static BoxRetryProperties defaults() {
    return new BoxRetryProperties(10, 25, 1.5, 20);
  }
}
