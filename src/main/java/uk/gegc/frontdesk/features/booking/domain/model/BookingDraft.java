package uk.gegc.frontdesk.features.booking.domain.model;

import java.time.LocalDateTime;

/**
 * Candidate booking values as they would be stored, checked before anything is persisted.
 */
public record BookingDraft(
        Long providerId,
        String clientName,
        String clientPhone,
        String clientEmail,
        String serviceType,
        LocalDateTime scheduledAt,
        String notes
) {
}
