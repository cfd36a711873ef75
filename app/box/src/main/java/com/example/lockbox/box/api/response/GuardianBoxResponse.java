package com.example.lockbox.box.api.response;

import com.example.lockbox.box.model.GuardianBoxView;

public record GuardianBoxResponse(GuardianBoxView box) {}
