package com.example.lockbox.box.service;

public class DocumentNotFoundException extends RuntimeException {

  public DocumentNotFoundException(String boxId, String documentId) {
    super("document not found: box_id=" + boxId + " document_id=" + documentId);
  }
}
