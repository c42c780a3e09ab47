package uk.gegc.frontdesk.features.booking.infra.store;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import uk.gegc.frontdesk.features.booking.domain.model.Booking;
import uk.gegc.frontdesk.features.booking.domain.model.BookingSearchCriteria;
import uk.gegc.frontdesk.features.booking.domain.repository.BookingRepository;
import uk.gegc.frontdesk.features.booking.domain.repository.BookingSpecifications;
import uk.gegc.frontdesk.shared.exception.ResourceNotFoundException;
import uk.gegc.frontdesk.shared.persistence.PageRequests;
import uk.gegc.frontdesk.shared.persistence.StorageCalls;

import java.time.Clock;
import java.time.Instant;

/**
 * Durable storage of bookings. Lists are ordered by {@code scheduledAt}, then by id.
 */
@Component
@RequiredArgsConstructor
public class BookingStore {

    private static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.ASC, "scheduledAt");

    private final BookingRepository bookingRepository;
    private final Clock clock;

    public Booking create(Booking booking) {
        Instant now = clock.instant();
        booking.setId(null);
        booking.setCreatedAt(now);
        booking.setUpdatedAt(now);
        return StorageCalls.call("create booking", () -> bookingRepository.saveAndFlush(booking));
    }

    public Booking get(Long id) {
        return StorageCalls.call("find booking", () -> bookingRepository.findById(id))
                .orElseThrow(() -> new ResourceNotFoundException("Booking " + id + " not found"));
    }

    public Page<Booking> list(BookingSearchCriteria criteria, Pageable pageable) {
        Pageable ordered = PageRequests.withStableOrder(pageable, DEFAULT_SORT);
        return StorageCalls.call("list bookings",
                () -> bookingRepository.findAll(BookingSpecifications.build(criteria), ordered));
    }

    public Booking update(Booking booking) {
        Long id = booking.getId();
        if (id == null || !StorageCalls.call("check booking", () -> bookingRepository.existsById(id))) {
            throw new ResourceNotFoundException("Booking " + id + " not found");
        }
        Instant now = clock.instant();
        Instant previous = booking.getUpdatedAt();
        booking.setUpdatedAt(previous != null && previous.isAfter(now) ? previous : now);
        return StorageCalls.call("update booking", () -> bookingRepository.saveAndFlush(booking));
    }

    public void delete(Long id) {
        if (!StorageCalls.call("check booking", () -> bookingRepository.existsById(id))) {
            throw new ResourceNotFoundException("Booking " + id + " not found");
        }
        StorageCalls.run("delete booking", () -> {
            bookingRepository.deleteById(id);
            bookingRepository.flush();
        });
    }
}
