package com.example.lockbox.box.api.request;

import jakarta.validation.constraints.NotBlank;

public record UnlockInitiateRequest(@NotBlank(message = "message is required") String message) {}
