package uk.gegc.frontdesk.features.booking.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import uk.gegc.frontdesk.BaseUnitTest;
import uk.gegc.frontdesk.features.booking.application.BookingMetricsService;
import uk.gegc.frontdesk.features.booking.domain.model.Booking;
import uk.gegc.frontdesk.features.booking.domain.model.BookingStatus;
import uk.gegc.frontdesk.features.booking.infra.store.BookingStore;
import uk.gegc.frontdesk.shared.exception.InvalidStatusTransitionException;
import uk.gegc.frontdesk.shared.exception.ResourceNotFoundException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BookingLifecycleManagerTest extends BaseUnitTest {

    @Mock
    private BookingStore bookingStore;

    @Mock
    private BookingMetricsService bookingMetricsService;

    @InjectMocks
    private BookingLifecycleManager lifecycleManager;

    private static Booking booking(Long id, BookingStatus status) {
        Booking booking = new Booking();
        booking.setId(id);
        booking.setProviderId(1L);
        booking.setStatus(status);
        return booking;
    }

    @Test
    @DisplayName("pending booking is confirmed and persisted")
    void confirmPending() {
        Booking pending = booking(1L, BookingStatus.PENDING);
        when(bookingStore.get(1L)).thenReturn(pending);
        when(bookingStore.update(any(Booking.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Booking result = lifecycleManager.transition(1L, BookingStatus.CONFIRMED);

        assertThat(result.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        verify(bookingStore).update(pending);
        verify(bookingMetricsService).recordTransition(BookingStatus.PENDING, BookingStatus.CONFIRMED);
    }

    @Test
    @DisplayName("completed booking cannot go back to pending and is left untouched")
    void terminalRefused() {
        Booking completed = booking(2L, BookingStatus.COMPLETED);
        when(bookingStore.get(2L)).thenReturn(completed);

        InvalidStatusTransitionException ex = assertThrows(InvalidStatusTransitionException.class,
                () -> lifecycleManager.transition(2L, BookingStatus.PENDING));

        assertThat(ex.getBookingId()).isEqualTo(2L);
        assertThat(ex.getCurrentStatus()).isEqualTo(BookingStatus.COMPLETED);
        assertThat(ex.getRequestedStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(completed.getStatus()).isEqualTo(BookingStatus.COMPLETED);
        verify(bookingStore, never()).update(any());
        verify(bookingMetricsService).recordRejectedTransition(BookingStatus.COMPLETED, BookingStatus.PENDING);
    }

    @Test
    @DisplayName("same-state request is refused")
    void sameStateRefused() {
        Booking pending = booking(3L, BookingStatus.PENDING);

        assertThrows(InvalidStatusTransitionException.class,
                () -> lifecycleManager.transition(pending, BookingStatus.PENDING));

        assertThat(pending.getStatus()).isEqualTo(BookingStatus.PENDING);
        verifyNoInteractions(bookingStore);
    }

    @Test
    @DisplayName("cancel works once, a second cancel is refused")
    void cancelTwice() {
        Booking pending = booking(4L, BookingStatus.PENDING);
        when(bookingStore.get(4L)).thenReturn(pending);
        when(bookingStore.update(any(Booking.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Booking cancelled = lifecycleManager.cancel(4L);
        assertThat(cancelled.getStatus()).isEqualTo(BookingStatus.CANCELLED);

        InvalidStatusTransitionException ex = assertThrows(InvalidStatusTransitionException.class,
                () -> lifecycleManager.cancel(4L));
        assertThat(ex.getCurrentStatus()).isEqualTo(BookingStatus.CANCELLED);
    }

    @Test
    @DisplayName("refused transitions stay refused however often they are retried")
    void retriesStayRefused() {
        Booking cancelled = booking(5L, BookingStatus.CANCELLED);

        for (int attempt = 0; attempt < 3; attempt++) {
            assertThrows(InvalidStatusTransitionException.class,
                    () -> lifecycleManager.transition(cancelled, BookingStatus.CONFIRMED));
        }

        assertThat(cancelled.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        verifyNoInteractions(bookingStore);
    }

    @Test
    @DisplayName("missing booking surfaces as not found")
    void missingBooking() {
        when(bookingStore.get(404L)).thenThrow(new ResourceNotFoundException("Booking 404 not found"));

        assertThrows(ResourceNotFoundException.class, () -> lifecycleManager.cancel(404L));
        verifyNoInteractions(bookingMetricsService);
    }
}
