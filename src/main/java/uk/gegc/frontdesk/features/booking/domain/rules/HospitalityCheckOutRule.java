package uk.gegc.frontdesk.features.booking.domain.rules;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.frontdesk.features.booking.config.BookingProperties;
import uk.gegc.frontdesk.features.booking.domain.model.BookingDraft;

import java.util.Optional;

/**
 * Stays are booked by check-in time; the check-out date travels in the notes.
 */
@Component
@RequiredArgsConstructor
public class HospitalityCheckOutRule implements SectorRule {

    static final String VIOLATION = "missing check-out date";

    private final BookingProperties bookingProperties;

    @Override
    public String sector() {
        return "hospitality";
    }

    @Override
    public Optional<String> evaluate(BookingDraft draft) {
        if (NotesKeywords.mentions(draft.notes(), bookingProperties.getCheckOutKeyword())) {
            return Optional.empty();
        }
        return Optional.of(VIOLATION);
    }
}
