/*
 * どこで: Box アプリの設定バインド
 * 何を: gateway からの内部呼び出しを認証するトークンとヘッダ名を保持する
 * なぜ: 利用者の認証は gateway が済ませ、Box サービスは転送元だけを検証するため
 */
package com.example.lockbox.box.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "box.internal-api")
@Validated
public record BoxInternalApiProperties(
    @DefaultValue("X-Internal-Token") @NotBlank String headerName,
    @NotBlank String token,
    @DefaultValue("X-User-Id") @NotBlank String userIdHeaderName) {}
