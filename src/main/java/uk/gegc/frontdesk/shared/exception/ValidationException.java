package uk.gegc.frontdesk.shared.exception;

/**
 * A generic or sector-specific precondition failed. The caller can recover by correcting the input.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
