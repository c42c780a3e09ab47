package uk.gegc.frontdesk.shared.exception;

import lombok.Getter;

/**
 * Raised when a booking refers to a provider id that does not exist.
 * Propagates like any other {@link ValidationException}.
 */
@Getter
public class ProviderReferenceException extends ValidationException {

    private final Long providerId;

    public ProviderReferenceException(Long providerId) {
        super("Provider with ID " + providerId + " not found");
        this.providerId = providerId;
    }
}
