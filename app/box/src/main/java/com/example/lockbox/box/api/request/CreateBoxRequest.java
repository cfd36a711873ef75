/*
 * どこで: Box API 入力 DTO
 * 何を: POST /v1/boxes/owned の入力を保持する
 * なぜ: Box 作成に必要な項目を API 境界で検証するため
 */
package com.example.lockbox.box.api.request;

import jakarta.validation.constraints.NotBlank;

public record CreateBoxRequest(
    @NotBlank(message = "name is required") String name,
    String description,
    String ownerName) {}
