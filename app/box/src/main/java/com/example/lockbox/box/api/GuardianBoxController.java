/*
 * どこで: Box API
 * 何を: ガーディアン向けの Box 参照、招待への応答、解錠リクエストの開始/投票エンドポイントを提供する
 * なぜ: ガーディアンの合意操作を HTTP から受け付けるため
 */
package com.example.lockbox.box.api;

import com.example.lockbox.box.api.request.InvitationResponseRequest;
import com.example.lockbox.box.api.request.UnlockInitiateRequest;
import com.example.lockbox.box.api.request.UnlockRespondRequest;
import com.example.lockbox.box.api.response.GuardianBoxResponse;
import com.example.lockbox.box.api.response.GuardianBoxesResponse;
import com.example.lockbox.box.model.BoxRecord;
import com.example.lockbox.box.service.BoxService;
import com.example.lockbox.box.service.GuardianLifecycleService;
import com.example.lockbox.box.service.UnlockRequestService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/boxes/guardian")
@RequiredArgsConstructor
@Validated
public class GuardianBoxController {

  private final BoxService boxService;
  private final GuardianLifecycleService guardianLifecycleService;
  private final UnlockRequestService unlockRequestService;

  @GetMapping
  public GuardianBoxesResponse list(
      @RequestHeader(BoxController.HEADER_USER_ID) @NotBlank(message = "X-User-Id is required")
          String userId) {
    return new GuardianBoxesResponse(boxService.listGuardianBoxes(userId));
  }

  @GetMapping("/{id}")
  public GuardianBoxResponse get(
      @RequestHeader(BoxController.HEADER_USER_ID) @NotBlank(message = "X-User-Id is required")
          String userId,
      @PathVariable("id") String boxId) {
    return new GuardianBoxResponse(boxService.getGuardianBox(boxId, userId));
  }

  /**
   * 役割:
   * - リードガーディアンが解錠リクエストを開始する。
   *
   * 期待動作:
   * - 既存のリクエストは置き換える。リードでなければ 400、ガーディアンでなければ 403。
   */
  @PatchMapping("/{id}/request")
  public GuardianBoxResponse initiateUnlock(
      @RequestHeader(BoxController.HEADER_USER_ID) @NotBlank(message = "X-User-Id is required")
          String userId,
      @PathVariable("id") String boxId,
      @Valid @RequestBody UnlockInitiateRequest request) {
    final BoxRecord updated = unlockRequestService.initiate(boxId, userId, request.message());
    return new GuardianBoxResponse(boxService.toGuardianView(updated, userId));
  }

  @PatchMapping("/{id}/respond")
  public GuardianBoxResponse respondToUnlock(
      @RequestHeader(BoxController.HEADER_USER_ID) @NotBlank(message = "X-User-Id is required")
          String userId,
      @PathVariable("id") String boxId,
      @RequestBody UnlockRespondRequest request) {
    final BoxRecord updated =
        unlockRequestService.respond(boxId, userId, request.approved(), request.rejected());
    return new GuardianBoxResponse(boxService.toGuardianView(updated, userId));
  }

  @PatchMapping("/{id}/invitation")
  public GuardianBoxResponse respondToInvitation(
      @RequestHeader(BoxController.HEADER_USER_ID) @NotBlank(message = "X-User-Id is required")
          String userId,
      @PathVariable("id") String boxId,
      @Valid @RequestBody InvitationResponseRequest request) {
    final BoxRecord updated =
        guardianLifecycleService.respondToInvitation(boxId, userId, request.accept());
    return new GuardianBoxResponse(boxService.toGuardianView(updated, userId));
  }
}
