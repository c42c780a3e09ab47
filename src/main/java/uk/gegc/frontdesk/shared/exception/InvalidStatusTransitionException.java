package uk.gegc.frontdesk.shared.exception;

import lombok.Getter;
import uk.gegc.frontdesk.features.booking.domain.model.BookingStatus;

@Getter
public class InvalidStatusTransitionException extends RuntimeException {

    private final Long bookingId;
    private final BookingStatus currentStatus;
    private final BookingStatus requestedStatus;

    public InvalidStatusTransitionException(Long bookingId, BookingStatus currentStatus, BookingStatus requestedStatus) {
        super("Booking " + bookingId + " cannot move from " + currentStatus.getValue()
                + " to " + (requestedStatus != null ? requestedStatus.getValue() : "null"));
        this.bookingId = bookingId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }
}
