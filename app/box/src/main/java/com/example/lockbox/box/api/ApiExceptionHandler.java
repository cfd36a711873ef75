/*
 * どこで: Box API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 競合/未検出/認可/入力不正を一貫したエラー応答で返すため
 */
package com.example.lockbox.box.api;

import com.example.lockbox.box.repository.BoxNotFoundException;
import com.example.lockbox.box.repository.BoxStoreException;
import com.example.lockbox.box.repository.VersionConflictException;
import com.example.lockbox.box.service.BoxAccessDeniedException;
import com.example.lockbox.box.service.DocumentNotFoundException;
import com.example.lockbox.box.service.GuardianNotFoundException;
import com.example.lockbox.box.service.InvalidBoxOperationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(BoxNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleBoxNotFound(BoxNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.BOX_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(GuardianNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleGuardianNotFound(GuardianNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.GUARDIAN_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleDocumentNotFound(DocumentNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.DOCUMENT_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(VersionConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleVersionConflict(VersionConflictException ex) {
    // 再試行上限まで競合した場合だけここに届く
    return error(
        HttpStatus.CONFLICT,
        ApiErrorCode.BOX_VERSION_CONFLICT,
        "box was modified concurrently, please retry");
  }

  @ExceptionHandler(BoxAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(BoxAccessDeniedException ex) {
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.BOX_ACCESS_DENIED, ex.getMessage());
  }

  @ExceptionHandler(InvalidBoxOperationException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidOperation(InvalidBoxOperationException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(BoxStoreException.class)
  public ResponseEntity<ApiErrorResponse> handleStoreFailure(BoxStoreException ex) {
    logger.error("box store failure", ex);
    // 内部の詳細は返さない
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.INTERNAL_ERROR, "internal error");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleHandlerMethodValidation(
      HandlerMethodValidationException ex) {
    final String message =
        ex.getAllErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSON パーサの内部文言は露出しない
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
