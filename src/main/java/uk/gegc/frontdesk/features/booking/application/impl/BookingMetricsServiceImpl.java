package uk.gegc.frontdesk.features.booking.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;
import uk.gegc.frontdesk.features.booking.application.BookingMetricsService;
import uk.gegc.frontdesk.features.booking.domain.model.BookingStatus;

import java.util.Locale;

/**
 * Micrometer-backed booking counters. Tagged counters are resolved per call; the registry caches them.
 */
@Service
public class BookingMetricsServiceImpl implements BookingMetricsService {

    static final String BOOKINGS_CREATED = "frontdesk.bookings.created";
    static final String TRANSITIONS = "frontdesk.bookings.transitions";
    static final String TRANSITIONS_REJECTED = "frontdesk.bookings.transitions.rejected";
    static final String RULE_VIOLATIONS = "frontdesk.bookings.rule.violations";

    private final MeterRegistry meterRegistry;

    public BookingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordBookingCreated(String sector) {
        Counter.builder(BOOKINGS_CREATED)
                .description("Number of bookings created")
                .tag("sector", sectorTag(sector))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordTransition(BookingStatus from, BookingStatus to) {
        Counter.builder(TRANSITIONS)
                .description("Number of accepted booking status transitions")
                .tag("from", statusTag(from))
                .tag("to", statusTag(to))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordRejectedTransition(BookingStatus from, BookingStatus to) {
        Counter.builder(TRANSITIONS_REJECTED)
                .description("Number of refused booking status transitions")
                .tag("from", statusTag(from))
                .tag("to", statusTag(to))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordRuleViolation(String sector) {
        Counter.builder(RULE_VIOLATIONS)
                .description("Number of bookings refused by a sector rule")
                .tag("sector", sectorTag(sector))
                .register(meterRegistry)
                .increment();
    }

    private static String statusTag(BookingStatus status) {
        return status == null ? "none" : status.getValue();
    }

    private static String sectorTag(String sector) {
        return sector == null ? "unknown" : sector.trim().toLowerCase(Locale.ROOT);
    }
}
