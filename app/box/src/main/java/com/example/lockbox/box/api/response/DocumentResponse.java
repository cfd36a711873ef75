package com.example.lockbox.box.api.response;

import com.example.lockbox.box.model.Document;

public record DocumentResponse(Document document) {}
