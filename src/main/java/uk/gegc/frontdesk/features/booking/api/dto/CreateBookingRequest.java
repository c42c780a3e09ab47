package uk.gegc.frontdesk.features.booking.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

@Schema(description = "Payload for creating a booking")
public record CreateBookingRequest(
        @Schema(description = "Provider receiving the booking", example = "1")
        @NotNull(message = "Provider id is required")
        Long providerId,

        @Schema(description = "Client full name", example = "Alex Morgan", maxLength = 255)
        @NotBlank(message = "Client name is required")
        @Size(max = 255, message = "Client name must be at most 255 characters")
        String clientName,

        @Schema(description = "Client phone", example = "+1-555-0142", maxLength = 50)
        @NotBlank(message = "Client phone is required")
        @Size(max = 50, message = "Client phone must be at most 50 characters")
        String clientPhone,

        @Schema(description = "Client email", example = "alex@example.com", maxLength = 255)
        @Email(message = "Client email must be a valid email address")
        @Size(max = 255, message = "Client email must be at most 255 characters")
        String clientEmail,

        @Schema(description = "Service requested, free text", example = "blood test", maxLength = 100)
        @Size(max = 100, message = "Service type must be at most 100 characters")
        String serviceType,

        @Schema(description = "Local date-time of the appointment; must be in the future", example = "2025-01-18T08:00:00")
        @NotNull(message = "Scheduled time is required")
        LocalDateTime scheduledAt,

        @Schema(
                description = "Free-form notes. Transportation bookings need a pickup location, hospitality bookings a check-out date",
                example = "Pickup: 5th Ave"
        )
        String notes
) {
}
