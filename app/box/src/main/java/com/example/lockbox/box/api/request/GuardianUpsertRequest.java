package com.example.lockbox.box.api.request;

import jakarta.validation.constraints.NotBlank;

/** PATCH /v1/boxes/owned/{id}/guardian の入力。id は新規追加時の仮 ID(省略時は採番)。 */
public record GuardianUpsertRequest(
    String id,
    @NotBlank(message = "invitationId is required") String invitationId,
    @NotBlank(message = "name is required") String name,
    @NotBlank(message = "email is required") String email,
    boolean leadGuardian) {}
