package io.chainnode.core.storage;

/** Unrecoverable persistence failure. The chain manager halts when it sees one. */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
