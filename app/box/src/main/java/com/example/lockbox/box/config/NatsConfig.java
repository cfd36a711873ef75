/*
 * どこで: Box アプリのインフラ設定
 * 何を: NATS Connection を Spring 管理下に置き、切断/再接続をログに残す
 * なぜ: 招待イベントの Subscriber が同一接続を再利用し、購読停止の原因を追えるようにするため
 */
package com.example.lockbox.box.config;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionName(properties.connectionName())
            .connectionTimeout(properties.connectionTimeout())
            .connectionListener(connectionListener())
            .build();
    return Nats.connect(options);
  }

  private ConnectionListener connectionListener() {
    return (connection, event) -> {
      switch (event) {
        case DISCONNECTED -> logger.warn("nats disconnected url={}", connection.getConnectedUrl());
        case RECONNECTED -> logger.info("nats reconnected url={}", connection.getConnectedUrl());
        default -> logger.debug("nats connection event={}", event);
      }
    };
  }
}
