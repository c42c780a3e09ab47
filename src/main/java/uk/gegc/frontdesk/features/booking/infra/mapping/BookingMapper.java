package uk.gegc.frontdesk.features.booking.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.frontdesk.features.booking.api.dto.BookingDto;
import uk.gegc.frontdesk.features.booking.api.dto.CreateBookingRequest;
import uk.gegc.frontdesk.features.booking.api.dto.UpdateBookingRequest;
import uk.gegc.frontdesk.features.booking.domain.model.Booking;
import uk.gegc.frontdesk.features.booking.domain.model.BookingDraft;
import uk.gegc.frontdesk.features.booking.domain.model.BookingStateMachine;

@Component
public class BookingMapper {

    public BookingDraft toDraft(CreateBookingRequest request) {
        return new BookingDraft(
                request.providerId(),
                request.clientName(),
                request.clientPhone(),
                request.clientEmail(),
                request.serviceType(),
                request.scheduledAt(),
                request.notes()
        );
    }

    public Booking toEntity(CreateBookingRequest request) {
        Booking booking = new Booking();
        booking.setProviderId(request.providerId());
        booking.setClientName(request.clientName());
        booking.setClientPhone(request.clientPhone());
        booking.setClientEmail(request.clientEmail());
        booking.setServiceType(request.serviceType());
        booking.setScheduledAt(request.scheduledAt());
        booking.setNotes(request.notes());
        booking.setStatus(BookingStateMachine.INITIAL_STATUS);
        return booking;
    }

    /**
     * Copies the provided non-status fields. Status goes through the lifecycle manager.
     */
    public void applyUpdates(Booking booking, UpdateBookingRequest request) {
        if (request.clientName() != null) {
            booking.setClientName(request.clientName());
        }
        if (request.clientPhone() != null) {
            booking.setClientPhone(request.clientPhone());
        }
        if (request.clientEmail() != null) {
            booking.setClientEmail(request.clientEmail());
        }
        if (request.serviceType() != null) {
            booking.setServiceType(request.serviceType());
        }
        if (request.scheduledAt() != null) {
            booking.setScheduledAt(request.scheduledAt());
        }
        if (request.notes() != null) {
            booking.setNotes(request.notes());
        }
    }

    public BookingDto toDto(Booking booking) {
        return new BookingDto(
                booking.getId(),
                booking.getProviderId(),
                booking.getClientName(),
                booking.getClientPhone(),
                booking.getClientEmail(),
                booking.getServiceType(),
                booking.getScheduledAt(),
                booking.getStatus(),
                booking.getNotes(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }
}
