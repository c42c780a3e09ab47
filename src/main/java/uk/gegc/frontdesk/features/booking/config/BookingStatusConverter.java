package uk.gegc.frontdesk.features.booking.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;
import uk.gegc.frontdesk.features.booking.domain.model.BookingStatus;

/**
 * Binds {@code ?status=pending} style request parameters.
 */
@Component
public class BookingStatusConverter implements Converter<String, BookingStatus> {

    @Override
    public BookingStatus convert(String source) {
        if (source.isBlank()) {
            return null;
        }
        return BookingStatus.from(source);
    }
}
