/*
 * どこで: Box API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.lockbox.box.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  BOX_NOT_FOUND,
  GUARDIAN_NOT_FOUND,
  DOCUMENT_NOT_FOUND,
  BOX_VERSION_CONFLICT,
  BOX_ACCESS_DENIED,
  INTERNAL_ERROR
}
