package com.phillippitts.scantomack.exception;

/**
 * Thrown when the configured Tesseract data directory does not exist.
 * Prevents the native engine from starting; other engines are unaffected.
 */
public class TessdataNotFoundException extends ScanToMackException {

    private final String dataPath;

    public TessdataNotFoundException(String dataPath) {
        super("Tesseract data not found at path: " + dataPath);
        this.dataPath = dataPath;
    }

    public String getDataPath() {
        return dataPath;
    }
}
