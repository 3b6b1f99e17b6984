package com.operatorsedge.core.store;

/**
 * Thrown when the lock on a state file could not be acquired within the configured timeout.
 * The caller's write was not applied; retrying the whole operation is safe.
 */
public class StateBusyException extends StateStoreException {

    public StateBusyException(String fileName, String message) {
        super(fileName, message);
    }
}
