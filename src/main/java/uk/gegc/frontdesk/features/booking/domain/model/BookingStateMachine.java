package uk.gegc.frontdesk.features.booking.domain.model;

import java.util.Set;

public enum BookingStateMachine {
    PENDING(Set.of(BookingStatus.CONFIRMED, BookingStatus.CANCELLED)),
    CONFIRMED(Set.of(BookingStatus.COMPLETED, BookingStatus.CANCELLED)),
    COMPLETED(Set.of()),
    CANCELLED(Set.of());

    public static final BookingStatus INITIAL_STATUS = BookingStatus.PENDING;

    private final Set<BookingStatus> allowedTransitions;

    BookingStateMachine(Set<BookingStatus> allowedTransitions) {
        this.allowedTransitions = allowedTransitions;
    }

    public boolean canTransitionTo(BookingStatus targetStatus) {
        if (targetStatus == null) {
            return false;
        }
        return allowedTransitions.contains(targetStatus);
    }

    public boolean isTerminal() {
        return allowedTransitions.isEmpty();
    }

    public static BookingStateMachine of(BookingStatus status) {
        return BookingStateMachine.valueOf(status.name());
    }

    public static boolean isValidTransition(BookingStatus from, BookingStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return of(from).canTransitionTo(to);
    }
}
