package uk.gegc.frontdesk.features.provider.domain.service;

import org.springframework.stereotype.Component;
import uk.gegc.frontdesk.features.provider.api.dto.CreateProviderRequest;
import uk.gegc.frontdesk.features.provider.api.dto.UpdateProviderRequest;

import static uk.gegc.frontdesk.shared.validation.RequiredFields.requireText;
import static uk.gegc.frontdesk.shared.validation.RequiredFields.requireTextIfPresent;

/**
 * Generic provider checks. Sector is an open tag, so only its presence is verified.
 */
@Component
public class ProviderValidator {

    public void validateRegistration(CreateProviderRequest request) {
        requireText(request.name(), "name");
        requireText(request.sector(), "sector");
    }

    public void validateUpdate(UpdateProviderRequest request) {
        requireTextIfPresent(request.name(), "name");
        requireTextIfPresent(request.sector(), "sector");
    }
}
