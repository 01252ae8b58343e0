package io.foreman.storage;

/**
 * Raised when the task store cannot be read or written. Aborts the current dispatch pass.
 */
public final class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
