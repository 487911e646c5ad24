package com.homework.core.exception;

/**
 * Raised when a document is submitted while a run for the same identity is still in flight.
 */
public class DocumentBusyException extends RuntimeException {

    private final String documentId;

    public DocumentBusyException(String documentId) {
        super("Document is already being processed: " + documentId);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
