/*
 * どこで: common のイベント payload 定義
 * 何を: 招待サービスが発行する招待イベントの形状を共通レコードとして提供する
 * なぜ: 発行側と Box サービスの購読側で同一のペイロード形状を共有するため
 */
package com.example.lockbox.common.event;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvitationEventPayload(
    @JsonProperty("event_type") @JsonAlias("eventType") String eventType,
    @JsonProperty("invitationId") @JsonAlias("invitation_id") String invitationId,
    @JsonProperty("boxId") @JsonAlias("box_id") String boxId,
    @JsonProperty("userId") @JsonAlias("user_id") String userId,
    @JsonProperty("inviteCode") @JsonAlias("invite_code") String inviteCode,
    @JsonProperty("timestamp") String timestamp) {

  public static final String INVITATION_CREATED = "invitation_created";
  public static final String INVITATION_OPENED = "invitation_opened";
  public static final String INVITATION_VIEWED = "invitation_viewed";
}
