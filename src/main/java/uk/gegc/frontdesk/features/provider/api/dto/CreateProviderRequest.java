package uk.gegc.frontdesk.features.provider.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "Payload for registering a provider")
public record CreateProviderRequest(
        @Schema(description = "Business name", example = "City Diagnostic Labs", maxLength = 255)
        @NotBlank(message = "Name is required")
        @Size(max = 255, message = "Name must be at most 255 characters")
        String name,

        @Schema(
                description = "Sector tag. Any value is accepted, see GET /api/v1/providers/sectors for suggestions",
                example = "laboratory",
                maxLength = 100
        )
        @NotBlank(message = "Sector is required")
        @Size(max = 100, message = "Sector must be at most 100 characters")
        String sector,

        @Schema(description = "Contact phone", example = "+1-555-0100", maxLength = 50)
        @Size(max = 50, message = "Phone must be at most 50 characters")
        String phone,

        @Schema(description = "Contact email", example = "desk@citylabs.example", maxLength = 255)
        @Email(message = "Email must be a valid email address")
        @Size(max = 255, message = "Email must be at most 255 characters")
        String email,

        @Schema(description = "Street address", example = "12 Harbour Road")
        String address
) {
}
