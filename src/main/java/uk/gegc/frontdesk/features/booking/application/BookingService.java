package uk.gegc.frontdesk.features.booking.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.frontdesk.features.booking.api.dto.BookingDto;
import uk.gegc.frontdesk.features.booking.api.dto.CreateBookingRequest;
import uk.gegc.frontdesk.features.booking.api.dto.UpdateBookingRequest;
import uk.gegc.frontdesk.features.booking.domain.model.BookingSearchCriteria;

/**
 * Entry point for booking operations. Every call validates fully before it writes anything.
 */
public interface BookingService {

    BookingDto createBooking(CreateBookingRequest request);

    BookingDto getBooking(Long id);

    Page<BookingDto> listBookings(BookingSearchCriteria criteria, Pageable pageable);

    BookingDto updateBooking(Long id, UpdateBookingRequest request);

    BookingDto cancelBooking(Long id);

    void deleteBooking(Long id);
}
