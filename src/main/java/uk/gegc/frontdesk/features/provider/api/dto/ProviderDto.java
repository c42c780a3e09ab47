package uk.gegc.frontdesk.features.provider.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Provider details")
public record ProviderDto(
        @Schema(description = "Provider identifier", example = "1")
        Long id,

        @Schema(description = "Business name")
        String name,

        @Schema(description = "Sector tag")
        String sector,

        @Schema(description = "Contact phone")
        String phone,

        @Schema(description = "Contact email")
        String email,

        @Schema(description = "Street address")
        String address,

        @Schema(description = "Whether the provider accepts bookings")
        boolean active,

        @Schema(description = "Creation timestamp")
        Instant createdAt,

        @Schema(description = "Last update timestamp")
        Instant updatedAt
) {
}
