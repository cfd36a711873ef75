/*
 * どこで: Box 内部 API
 * 何を: 招待イベントを HTTP で一括受信し、NATS 経由と同じハンドラで処理する
 * なぜ: 取りこぼしたイベントの再投入やバッチ配送元からの取り込みに使うため
 */
package com.example.lockbox.box.api;

import com.example.lockbox.box.service.InvitationBatchResult;
import com.example.lockbox.box.service.InvitationEventHandler;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class InvitationEventController {

  private final InvitationEventHandler invitationEventHandler;

  @PostMapping("/internal/invitation-events:batch")
  public InvitationBatchResult replay(@RequestBody List<JsonNode> events) {
    return invitationEventHandler.handleBatch(events);
  }
}
