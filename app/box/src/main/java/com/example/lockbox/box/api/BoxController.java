/*
 * どこで: Box API
 * 何を: オーナー向けの Box/ガーディアン/文書管理エンドポイントを提供する
 * なぜ: オーナー操作を HTTP から受け付け、同時更新に強いサービス層へ委譲するため
 */
package com.example.lockbox.box.api;

import com.example.lockbox.box.api.request.CreateBoxRequest;
import com.example.lockbox.box.api.request.DocumentUpsertRequest;
import com.example.lockbox.box.api.request.GuardianUpsertRequest;
import com.example.lockbox.box.api.request.UpdateBoxRequest;
import com.example.lockbox.box.api.response.BoxResponse;
import com.example.lockbox.box.api.response.BoxesResponse;
import com.example.lockbox.box.api.response.DocumentResponse;
import com.example.lockbox.box.api.response.GuardianResponse;
import com.example.lockbox.box.model.BoxRecord;
import com.example.lockbox.box.service.BoxService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/boxes/owned")
@RequiredArgsConstructor
@Validated
public class BoxController {

  static final String HEADER_USER_ID = "X-User-Id";

  private final BoxService boxService;

  @GetMapping
  public BoxesResponse list(
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId) {
    return new BoxesResponse(boxService.listOwnedBoxes(userId));
  }

  @PostMapping
  public ResponseEntity<BoxResponse> create(
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @Valid @RequestBody CreateBoxRequest request) {
    final BoxRecord created =
        boxService.createBox(userId, request.ownerName(), request.name(), request.description());
    return ResponseEntity.status(HttpStatus.CREATED).body(new BoxResponse(created));
  }

  @GetMapping("/{id}")
  public BoxResponse get(
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @PathVariable("id") String boxId) {
    return new BoxResponse(boxService.getOwnedBox(boxId, userId));
  }

  /**
   * 役割:
   * - name/description/isLocked/unlockInstructions の部分更新。
   *
   * 期待動作:
   * - 指定のない項目は変更しない。unlockInstructions に null を明示すると削除する。
   */
  @PatchMapping("/{id}")
  public BoxResponse update(
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @PathVariable("id") String boxId,
      @RequestBody UpdateBoxRequest request) {
    return new BoxResponse(boxService.updateBox(boxId, userId, request.toPatch()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @PathVariable("id") String boxId) {
    boxService.deleteBox(boxId, userId);
    return ResponseEntity.noContent().build();
  }

  /**
   * 役割:
   * - invitationId をキーにガーディアンを追加/更新する。
   *
   * 期待動作:
   * - 新規は invited で追加し、既存は状態を保ったまま名前/メール/リード指定だけ更新する。
   */
  @PatchMapping("/{id}/guardian")
  public GuardianResponse upsertGuardian(
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @PathVariable("id") String boxId,
      @Valid @RequestBody GuardianUpsertRequest request) {
    final BoxRecord updated =
        boxService.upsertGuardian(
            boxId,
            userId,
            request.id(),
            request.invitationId(),
            request.name(),
            request.email(),
            request.leadGuardian());
    return new GuardianResponse(
        updated
            .findGuardianByInvitationId(request.invitationId())
            .orElseThrow());
  }

  @DeleteMapping("/{id}/guardian/{guardianId}")
  public BoxResponse deleteGuardian(
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @PathVariable("id") String boxId,
      @PathVariable("guardianId") String guardianId) {
    return new BoxResponse(boxService.deleteGuardian(boxId, userId, guardianId));
  }

  @PatchMapping("/{id}/document")
  public DocumentResponse upsertDocument(
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @PathVariable("id") String boxId,
      @Valid @RequestBody DocumentUpsertRequest request) {
    final String documentId = request.id() != null ? request.id() : UUID.randomUUID().toString();
    final BoxRecord updated =
        boxService.upsertDocument(boxId, userId, documentId, request.title(), request.content());
    return new DocumentResponse(updated.findDocument(documentId).orElseThrow());
  }

  @DeleteMapping("/{id}/document/{documentId}")
  public BoxResponse deleteDocument(
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @PathVariable("id") String boxId,
      @PathVariable("documentId") String documentId) {
    return new BoxResponse(boxService.deleteDocument(boxId, userId, documentId));
  }
}
