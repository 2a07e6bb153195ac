package com.phillippitts.scantomack.exception;

/**
 * Thrown when the input document or its options are unusable
 * (empty, undecodable, or unsupported engine selection).
 */
public class InvalidDocumentException extends ScanToMackException {

    private final int documentSize;
    private final String reason;

    public InvalidDocumentException(String reason) {
        super("Invalid document: " + reason);
        this.documentSize = 0;
        this.reason = reason;
    }

    public InvalidDocumentException(int documentSize, String reason) {
        super("Invalid document (" + documentSize + " bytes): " + reason);
        this.documentSize = documentSize;
        this.reason = reason;
    }

    public int getDocumentSize() {
        return documentSize;
    }

    public String getReason() {
        return reason;
    }
}
