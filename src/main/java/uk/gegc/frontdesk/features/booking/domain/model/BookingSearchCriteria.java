package uk.gegc.frontdesk.features.booking.domain.model;

import java.time.LocalDateTime;

/**
 * Booking list filter; {@code from} and {@code to} are both inclusive. Null fields do not filter.
 */
public record BookingSearchCriteria(
        Long providerId,
        BookingStatus status,
        LocalDateTime from,
        LocalDateTime to
) {

    public static BookingSearchCriteria none() {
        return new BookingSearchCriteria(null, null, null, null);
    }
}
