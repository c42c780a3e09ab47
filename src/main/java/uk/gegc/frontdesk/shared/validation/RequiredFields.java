package uk.gegc.frontdesk.shared.validation;

import uk.gegc.frontdesk.shared.exception.ValidationException;

public final class RequiredFields {

    private RequiredFields() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static void requireText(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(fieldName + " must not be blank");
        }
    }

    /**
     * Partial updates leave omitted fields untouched, so only a provided value is checked.
     */
    public static void requireTextIfPresent(String value, String fieldName) {
        if (value != null && value.isBlank()) {
            throw new ValidationException(fieldName + " must not be blank");
        }
    }
}
