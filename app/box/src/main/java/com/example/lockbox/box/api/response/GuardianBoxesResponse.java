package com.example.lockbox.box.api.response;

import com.example.lockbox.box.model.GuardianBoxView;
import java.util.List;

public record GuardianBoxesResponse(List<GuardianBoxView> boxes) {}
