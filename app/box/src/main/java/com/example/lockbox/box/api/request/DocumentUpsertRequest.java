package com.example.lockbox.box.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record DocumentUpsertRequest(
    String id,
    @NotBlank(message = "title is required") String title,
    @NotNull(message = "content is required") String content) {}
