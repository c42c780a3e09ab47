package uk.gegc.frontdesk.features.booking.application;

import uk.gegc.frontdesk.features.booking.domain.model.BookingStatus;

/**
 * Counters for booking activity.
 */
public interface BookingMetricsService {

    void recordBookingCreated(String sector);

    void recordTransition(BookingStatus from, BookingStatus to);

    void recordRejectedTransition(BookingStatus from, BookingStatus to);

    void recordRuleViolation(String sector);
}
