package uk.gegc.frontdesk.features.provider.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

@Schema(description = "Partial update of a provider; omitted fields are left unchanged")
public record UpdateProviderRequest(
        @Schema(description = "Business name", maxLength = 255)
        @Size(max = 255, message = "Name must be at most 255 characters")
        String name,

        @Schema(description = "Sector tag", maxLength = 100)
        @Size(max = 100, message = "Sector must be at most 100 characters")
        String sector,

        @Schema(description = "Contact phone", maxLength = 50)
        @Size(max = 50, message = "Phone must be at most 50 characters")
        String phone,

        @Schema(description = "Contact email", maxLength = 255)
        @Email(message = "Email must be a valid email address")
        @Size(max = 255, message = "Email must be at most 255 characters")
        String email,

        @Schema(description = "Street address")
        String address,

        @Schema(description = "Whether the provider accepts bookings", example = "false")
        Boolean active
) {
}
