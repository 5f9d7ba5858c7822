package com.automotiveiot.jdbcsink;

/**
 * A driving record could not be written. The records themselves are intact, so the caller may
 * retry the same write.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
