package uk.gegc.frontdesk.features.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.frontdesk.features.booking.api.dto.UpdateBookingRequest;
import uk.gegc.frontdesk.features.booking.application.BookingMetricsService;
import uk.gegc.frontdesk.features.booking.config.BookingProperties;
import uk.gegc.frontdesk.features.booking.domain.model.Booking;
import uk.gegc.frontdesk.features.booking.domain.model.BookingDraft;
import uk.gegc.frontdesk.features.booking.domain.rules.SectorRuleRegistry;
import uk.gegc.frontdesk.features.provider.domain.model.Provider;
import uk.gegc.frontdesk.features.provider.infra.store.ProviderStore;
import uk.gegc.frontdesk.shared.exception.ProviderReferenceException;
import uk.gegc.frontdesk.shared.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;

import static uk.gegc.frontdesk.shared.validation.RequiredFields.requireText;
import static uk.gegc.frontdesk.shared.validation.RequiredFields.requireTextIfPresent;

/**
 * Checks a booking before it is written: provider reference, required fields, schedule and
 * the rule registered for the provider's sector. Reads only; never persists.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingValidator {

    static final String PAST_SCHEDULE = "Scheduled time must be in the future";
    static final String INACTIVE_PROVIDER = "Provider is not active and cannot accept bookings";

    private final ProviderStore providerStore;
    private final SectorRuleRegistry sectorRuleRegistry;
    private final BookingProperties bookingProperties;
    private final BookingMetricsService bookingMetricsService;
    private final Clock clock;

    /**
     * @return the referenced provider, so callers can tag metrics by sector without a second lookup
     */
    public Provider validateCreation(BookingDraft draft) {
        Provider provider = resolveProvider(draft.providerId());
        if (!provider.isActive() && bookingProperties.isRejectInactiveProviders()) {
            throw new ValidationException(INACTIVE_PROVIDER);
        }

        requireText(draft.clientName(), "clientName");
        requireText(draft.clientPhone(), "clientPhone");
        requireFuture(draft.scheduledAt());
        applySectorRule(provider, draft);
        return provider;
    }

    /**
     * Checks only what the update provides. The schedule is re-checked when it moves, and the
     * sector rule runs again when the schedule or notes change.
     */
    public void validateUpdate(Booking booking, UpdateBookingRequest request) {
        requireTextIfPresent(request.clientName(), "clientName");
        requireTextIfPresent(request.clientPhone(), "clientPhone");

        boolean rescheduled = request.scheduledAt() != null
                && !request.scheduledAt().equals(booking.getScheduledAt());
        boolean notesChanged = request.notes() != null
                && !Objects.equals(request.notes(), booking.getNotes());

        if (rescheduled) {
            requireFuture(request.scheduledAt());
        }
        if (rescheduled || notesChanged) {
            Provider provider = resolveProvider(booking.getProviderId());
            applySectorRule(provider, mergedDraft(booking, request));
        }
    }

    private Provider resolveProvider(Long providerId) {
        if (providerId == null) {
            throw new ValidationException("providerId must not be null");
        }
        return providerStore.find(providerId)
                .orElseThrow(() -> new ProviderReferenceException(providerId));
    }

    private void requireFuture(LocalDateTime scheduledAt) {
        if (scheduledAt == null) {
            throw new ValidationException("scheduledAt must not be null");
        }
        if (!scheduledAt.isAfter(LocalDateTime.now(clock))) {
            throw new ValidationException(PAST_SCHEDULE);
        }
    }

    private void applySectorRule(Provider provider, BookingDraft draft) {
        sectorRuleRegistry.find(provider.getSector()).ifPresent(rule ->
                rule.evaluate(draft).ifPresent(violation -> {
                    log.debug("Sector rule '{}' refused booking for provider {}: {}",
                            rule.sector(), provider.getId(), violation);
                    bookingMetricsService.recordRuleViolation(provider.getSector());
                    throw new ValidationException(violation);
                }));
    }

    private static BookingDraft mergedDraft(Booking booking, UpdateBookingRequest request) {
        return new BookingDraft(
                booking.getProviderId(),
                request.clientName() != null ? request.clientName() : booking.getClientName(),
                request.clientPhone() != null ? request.clientPhone() : booking.getClientPhone(),
                request.clientEmail() != null ? request.clientEmail() : booking.getClientEmail(),
                request.serviceType() != null ? request.serviceType() : booking.getServiceType(),
                request.scheduledAt() != null ? request.scheduledAt() : booking.getScheduledAt(),
                request.notes() != null ? request.notes() : booking.getNotes()
        );
    }
}
