package com.example.lockbox.box.api.request;

import jakarta.validation.constraints.NotNull;

public record InvitationResponseRequest(@NotNull(message = "accept is required") Boolean accept) {}
