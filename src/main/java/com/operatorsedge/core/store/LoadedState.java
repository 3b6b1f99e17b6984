package com.operatorsedge.core.store;

/**
 * A state value together with how it was obtained from disk.
 *
 * @param value  the parsed value, or the default shape when the file was missing or corrupt
 * @param status what was found on disk
 * @param error  parse or I/O error message when {@code status} is {@link Status#CORRUPT}, otherwise null
 */
public record LoadedState<T>(T value, Status status, String error) {

    public enum Status { VALID, MISSING, CORRUPT }

    public boolean isValid() {
        return status == Status.VALID;
    }
}
