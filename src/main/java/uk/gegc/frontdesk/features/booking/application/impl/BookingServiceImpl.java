package uk.gegc.frontdesk.features.booking.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.frontdesk.features.booking.api.dto.BookingDto;
import uk.gegc.frontdesk.features.booking.api.dto.CreateBookingRequest;
import uk.gegc.frontdesk.features.booking.api.dto.UpdateBookingRequest;
import uk.gegc.frontdesk.features.booking.application.BookingMetricsService;
import uk.gegc.frontdesk.features.booking.application.BookingService;
import uk.gegc.frontdesk.features.booking.domain.model.Booking;
import uk.gegc.frontdesk.features.booking.domain.model.BookingSearchCriteria;
import uk.gegc.frontdesk.features.booking.domain.service.BookingLifecycleManager;
import uk.gegc.frontdesk.features.booking.domain.service.BookingValidator;
import uk.gegc.frontdesk.features.booking.infra.mapping.BookingMapper;
import uk.gegc.frontdesk.features.booking.infra.store.BookingStore;
import uk.gegc.frontdesk.features.provider.domain.model.Provider;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class BookingServiceImpl implements BookingService {

    private final BookingStore bookingStore;
    private final BookingValidator bookingValidator;
    private final BookingLifecycleManager bookingLifecycleManager;
    private final BookingMapper bookingMapper;
    private final BookingMetricsService bookingMetricsService;

    @Override
    public BookingDto createBooking(CreateBookingRequest request) {
        Provider provider = bookingValidator.validateCreation(bookingMapper.toDraft(request));

        Booking saved = bookingStore.create(bookingMapper.toEntity(request));
        bookingMetricsService.recordBookingCreated(provider.getSector());
        log.info("Created booking {} for provider {} at {}", saved.getId(), saved.getProviderId(), saved.getScheduledAt());
        return bookingMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public BookingDto getBooking(Long id) {
        return bookingMapper.toDto(bookingStore.get(id));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<BookingDto> listBookings(BookingSearchCriteria criteria, Pageable pageable) {
        return bookingStore.list(criteria, pageable).map(bookingMapper::toDto);
    }

    @Override
    public BookingDto updateBooking(Long id, UpdateBookingRequest request) {
        Booking booking = bookingStore.get(id);

        bookingValidator.validateUpdate(booking, request);
        if (request.status() != null) {
            bookingLifecycleManager.ensureAllowed(booking, request.status());
        }

        bookingMapper.applyUpdates(booking, request);
        Booking saved;
        if (request.status() != null) {
            saved = bookingLifecycleManager.transition(booking, request.status());
        } else {
            saved = bookingStore.update(booking);
            log.info("Updated booking {}", saved.getId());
        }
        return bookingMapper.toDto(saved);
    }

    @Override
    public BookingDto cancelBooking(Long id) {
        return bookingMapper.toDto(bookingLifecycleManager.cancel(id));
    }

    @Override
    public void deleteBooking(Long id) {
        bookingStore.delete(id);
        log.info("Deleted booking {}", id);
    }
}
