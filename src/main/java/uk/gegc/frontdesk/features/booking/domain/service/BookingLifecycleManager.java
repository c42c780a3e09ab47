package uk.gegc.frontdesk.features.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.frontdesk.features.booking.application.BookingMetricsService;
import uk.gegc.frontdesk.features.booking.domain.model.Booking;
import uk.gegc.frontdesk.features.booking.domain.model.BookingStateMachine;
import uk.gegc.frontdesk.features.booking.domain.model.BookingStatus;
import uk.gegc.frontdesk.features.booking.infra.store.BookingStore;
import uk.gegc.frontdesk.shared.exception.InvalidStatusTransitionException;

/**
 * The only place a booking's status changes after creation. Edges are defined by
 * {@link BookingStateMachine}; everything else, including a move to the current status, is refused.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingLifecycleManager {

    private final BookingStore bookingStore;
    private final BookingMetricsService bookingMetricsService;

    public Booking transition(Long bookingId, BookingStatus target) {
        return transition(bookingStore.get(bookingId), target);
    }

    /**
     * Moves an already loaded booking to {@code target} and persists it together with any
     * other pending field changes on the entity.
     */
    public Booking transition(Booking booking, BookingStatus target) {
        ensureAllowed(booking, target);

        BookingStatus from = booking.getStatus();
        booking.setStatus(target);
        Booking saved = bookingStore.update(booking);

        log.info("Booking {} moved from {} to {}", saved.getId(), from.getValue(), target.getValue());
        bookingMetricsService.recordTransition(from, target);
        return saved;
    }

    public Booking cancel(Long bookingId) {
        return transition(bookingId, BookingStatus.CANCELLED);
    }

    public void ensureAllowed(Booking booking, BookingStatus target) {
        BookingStatus current = booking.getStatus();
        if (!BookingStateMachine.isValidTransition(current, target)) {
            log.warn("Refused transition of booking {} from {} to {}", booking.getId(),
                    current != null ? current.getValue() : null, target != null ? target.getValue() : null);
            bookingMetricsService.recordRejectedTransition(current, target);
            throw new InvalidStatusTransitionException(booking.getId(), current, target);
        }
    }
}
