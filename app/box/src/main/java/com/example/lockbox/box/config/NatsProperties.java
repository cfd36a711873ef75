/*
 * どこで: Box アプリの設定バインド
 * 何を: NATS 接続先・接続タイムアウト・接続名を保持する
 * なぜ: 招待イベントの購読先を環境ごとに切り替え、サーバ側の監視で接続元を識別できるようにするため
 */
package com.example.lockbox.box.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "nats")
@Validated
public record NatsProperties(
    @DefaultValue("true") boolean enabled,
    @NotBlank String url,
    @DefaultValue("5s") @NotNull Duration connectionTimeout,
    @DefaultValue("box-service") String connectionName) {}
