package com.example.lockbox.box.api.response;

import com.example.lockbox.box.model.Guardian;

public record GuardianResponse(Guardian guardian) {}
