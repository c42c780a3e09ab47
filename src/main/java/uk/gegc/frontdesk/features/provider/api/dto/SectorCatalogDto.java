package uk.gegc.frontdesk.features.provider.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Sector vocabulary known to the service")
public record SectorCatalogDto(
        @Schema(description = "Suggested sector names; not enforced", example = "[\"medical\", \"laboratory\"]")
        List<String> recommended,

        @Schema(description = "Sectors with extra booking rules", example = "[\"hospitality\", \"laboratory\", \"transportation\"]")
        List<String> withBookingRules
) {
}
