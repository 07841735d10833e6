package io.powledger.core.storage;

/** The backing storage failed; the operation was aborted without partial writes. */
public class StoreUnavailableException extends IllegalStateException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
