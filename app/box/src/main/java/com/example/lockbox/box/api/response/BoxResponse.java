package com.example.lockbox.box.api.response;

import com.example.lockbox.box.model.BoxRecord;

public record BoxResponse(BoxRecord box) {}
