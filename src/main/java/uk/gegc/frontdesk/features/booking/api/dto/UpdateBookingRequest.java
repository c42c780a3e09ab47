package uk.gegc.frontdesk.features.booking.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import uk.gegc.frontdesk.features.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;

@Schema(description = "Partial update of a booking; omitted fields are left unchanged")
public record UpdateBookingRequest(
        @Schema(description = "Client full name", maxLength = 255)
        @Size(max = 255, message = "Client name must be at most 255 characters")
        String clientName,

        @Schema(description = "Client phone", maxLength = 50)
        @Size(max = 50, message = "Client phone must be at most 50 characters")
        String clientPhone,

        @Schema(description = "Client email", maxLength = 255)
        @Email(message = "Client email must be a valid email address")
        @Size(max = 255, message = "Client email must be at most 255 characters")
        String clientEmail,

        @Schema(description = "Service requested", maxLength = 100)
        @Size(max = 100, message = "Service type must be at most 100 characters")
        String serviceType,

        @Schema(description = "New appointment time; must be in the future", example = "2025-01-20T10:30:00")
        LocalDateTime scheduledAt,

        @Schema(description = "Requested status", example = "confirmed",
                allowableValues = {"pending", "confirmed", "completed", "cancelled"})
        BookingStatus status,

        @Schema(description = "Free-form notes")
        String notes
) {
}
