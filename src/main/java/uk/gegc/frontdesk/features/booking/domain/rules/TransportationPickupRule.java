package uk.gegc.frontdesk.features.booking.domain.rules;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.frontdesk.features.booking.config.BookingProperties;
import uk.gegc.frontdesk.features.booking.domain.model.BookingDraft;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class TransportationPickupRule implements SectorRule {

    static final String VIOLATION = "missing pickup location";

    private final BookingProperties bookingProperties;

    @Override
    public String sector() {
        return "transportation";
    }

    @Override
    public Optional<String> evaluate(BookingDraft draft) {
        if (NotesKeywords.mentions(draft.notes(), bookingProperties.getPickupKeyword())) {
            return Optional.empty();
        }
        return Optional.of(VIOLATION);
    }
}
