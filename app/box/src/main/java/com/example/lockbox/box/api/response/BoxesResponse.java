package com.example.lockbox.box.api.response;

import com.example.lockbox.box.model.BoxRecord;
import java.util.List;

public record BoxesResponse(List<BoxRecord> boxes) {}
