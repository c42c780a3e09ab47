package uk.gegc.frontdesk.shared.exception;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * The underlying durable-storage call failed. Never retried inside the service; callers may retry
 * the whole operation since validation is re-run every time.
 */
public class StorageFailureException extends RuntimeException {

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isConstraintViolation() {
        return getCause() instanceof DataIntegrityViolationException;
    }
}
