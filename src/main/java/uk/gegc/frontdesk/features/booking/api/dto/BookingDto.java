package uk.gegc.frontdesk.features.booking.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.frontdesk.features.booking.domain.model.BookingStatus;

import java.time.Instant;
import java.time.LocalDateTime;

@Schema(description = "Booking details")
public record BookingDto(
        @Schema(description = "Booking identifier", example = "42")
        Long id,

        @Schema(description = "Provider receiving the booking")
        Long providerId,

        @Schema(description = "Client full name")
        String clientName,

        @Schema(description = "Client phone")
        String clientPhone,

        @Schema(description = "Client email")
        String clientEmail,

        @Schema(description = "Service requested")
        String serviceType,

        @Schema(description = "Appointment time (local)")
        LocalDateTime scheduledAt,

        @Schema(description = "Current status", example = "pending")
        BookingStatus status,

        @Schema(description = "Free-form notes")
        String notes,

        @Schema(description = "Creation timestamp")
        Instant createdAt,

        @Schema(description = "Last update timestamp")
        Instant updatedAt
) {
}
