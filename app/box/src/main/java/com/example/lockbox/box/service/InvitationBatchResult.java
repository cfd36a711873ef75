package com.example.lockbox.box.service;

/** 招待イベントの一括処理件数。 */
public record InvitationBatchResult(int applied, int ignored, int skipped, int failed) {}
