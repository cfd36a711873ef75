/*
 * どこで: Box ドメインモデル
 * 何を: Box に格納される文書1件を表す
 * なぜ: オーナーの文書追加/更新/削除で共通の形を使うため
 */
package com.example.lockbox.box.model;

import java.time.Instant;

public record Document(String id, String title, String content, Instant createdAt) {}
