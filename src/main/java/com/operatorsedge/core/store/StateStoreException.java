package com.operatorsedge.core.store;

/**
 * Thrown when a state file cannot be read, written or locked.
 */
public class StateStoreException extends RuntimeException {

    private final String fileName;

    public StateStoreException(String fileName, String message) {
        super(message);
        this.fileName = fileName;
    }

    public StateStoreException(String fileName, String message, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
