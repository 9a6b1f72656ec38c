package com.simscan.error;

/**
 * I/O fault on the blob area or the metadata store, including timeouts.
 * Transient faults may be retried by the caller; nothing in the scan path retries on its own.
 */
public class StorageException extends SimScanException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return "storage_error";
    }
}
