package uk.gegc.frontdesk.features.booking.domain.rules;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.frontdesk.features.booking.config.BookingProperties;
import uk.gegc.frontdesk.features.booking.domain.model.BookingDraft;

import java.util.Optional;

/**
 * Laboratories only take samples during opening hours, 08:00 to 18:00 by default.
 */
@Component
@RequiredArgsConstructor
public class LaboratoryHoursRule implements SectorRule {

    static final String VIOLATION = "outside operating hours";

    private final BookingProperties bookingProperties;

    @Override
    public String sector() {
        return "laboratory";
    }

    @Override
    public Optional<String> evaluate(BookingDraft draft) {
        if (draft.scheduledAt() == null) {
            return Optional.empty();
        }
        int hour = draft.scheduledAt().getHour();
        if (hour < bookingProperties.getLaboratoryOpeningHour() || hour >= bookingProperties.getLaboratoryClosingHour()) {
            return Optional.of(VIOLATION);
        }
        return Optional.empty();
    }
}
