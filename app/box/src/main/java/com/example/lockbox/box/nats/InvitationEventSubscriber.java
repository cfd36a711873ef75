/*
 * どこで: Box NATS 購読
 * 何を: 招待イベントを JetStream から購読し、ハンドラの結果に応じて ack/nak/term する
 * なぜ: 招待の閲覧をガーディアン状態へ確実に反映し、回復しない失敗だけ再配信を止めるため
 */
package com.example.lockbox.box.nats;

import com.example.lockbox.box.config.BoxInvitationNatsProperties;
import com.example.lockbox.box.repository.VersionConflictException;
import com.example.lockbox.box.service.InvitationEventHandler;
import com.example.lockbox.box.service.InvitationEventOutcome;
import com.example.lockbox.box.service.InvitationEventPermanentException;
import com.example.lockbox.common.TraceIds;
import com.example.lockbox.common.event.InvitationEventPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class InvitationEventSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(InvitationEventSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;
  private static final String MSG_ID_HEADER = "Nats-Msg-Id";

  private final Connection connection;
  private final InvitationEventHandler eventHandler;
  private final BoxInvitationNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public InvitationEventSubscriber(
      Connection connection,
      InvitationEventHandler eventHandler,
      BoxInvitationNatsProperties properties,
      ObjectMapper objectMapper) {
    this.connection = connection;
    this.eventHandler = eventHandler;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.subject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "invitation subscriber started subject={} stream={} durable={}",
          properties.subject(),
          properties.stream(),
          properties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    MDC.put("trace_id", TraceIds.resolve(resolveMessageId(message)));
    try {
      final InvitationEventPayload event =
          objectMapper.readValue(message.getData(), InvitationEventPayload.class);
      putIfPresent("box_id", event.boxId());
      putIfPresent("invitation_id", event.invitationId());
      final InvitationEventOutcome outcome = eventHandler.handle(event);
      message.ack();
      logger.debug(
          "invitation event acked event_type={} outcome={} redelivered={}",
          event.eventType(),
          outcome,
          message.isJetStream() && message.metaData().deliveredCount() > 1);
    } catch (JsonProcessingException ex) {
      // 壊れた payload は再配信で回復しないため TERM する
      logger.warn("failed to parse invitation event payload", ex);
      termSilently(message);
    } catch (IOException ex) {
      logger.warn("failed to read invitation event payload", ex);
      termSilently(message);
    } catch (InvitationEventPermanentException ex) {
      logger.warn("permanent failure while handling invitation event", ex);
      termSilently(message);
    } catch (DataAccessException | VersionConflictException ex) {
      // DB 障害や再試行上限までの競合は再配信で回復しうる
      logger.warn("temporary failure while handling invitation event", ex);
      nakSilently(message);
    } catch (RuntimeException ex) {
      // 不明な例外はデータロス回避のため再配信に倒す
      logger.warn("failed to handle invitation event", ex);
      nakSilently(message);
    } finally {
      MDC.remove("trace_id");
      MDC.remove("box_id");
      MDC.remove("invitation_id");
    }
  }

  private void putIfPresent(String key, String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
    }
  }

  private String resolveMessageId(Message message) {
    if (message.getHeaders() == null) {
      return null;
    }
    return message.getHeaders().getFirst(MSG_ID_HEADER);
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
          && ex.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
    logger.info(
        "invitation stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    // ack-wait は Box 更新の再試行(合計で約3秒)が収まる長さにしておく
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nack nats message", ex);
    }
  }

  private void termSilently(Message message) {
    try {
      message.term();
    } catch (IllegalStateException ex) {
      logger.warn("failed to term nats message", ex);
    }
  }
}
