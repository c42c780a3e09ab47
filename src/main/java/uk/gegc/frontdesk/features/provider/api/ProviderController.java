package uk.gegc.frontdesk.features.provider.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.frontdesk.features.provider.api.dto.CreateProviderRequest;
import uk.gegc.frontdesk.features.provider.api.dto.ProviderDto;
import uk.gegc.frontdesk.features.provider.api.dto.SectorCatalogDto;
import uk.gegc.frontdesk.features.provider.api.dto.UpdateProviderRequest;
import uk.gegc.frontdesk.features.provider.application.ProviderService;

@RestController
@RequestMapping("/api/v1/providers")
@RequiredArgsConstructor
@Tag(name = "Providers", description = "Registration and maintenance of businesses that accept bookings")
public class ProviderController {

    private final ProviderService providerService;

    @Operation(summary = "Register a provider", description = "Creates an active provider in any sector.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Provider registered",
                    content = @Content(schema = @Schema(implementation = ProviderDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<ProviderDto> registerProvider(@Valid @RequestBody CreateProviderRequest request) {
        ProviderDto created = providerService.registerProvider(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "List providers", description = "Returns providers in registration order, optionally filtered by sector.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of providers returned")
    })
    @GetMapping
    public ResponseEntity<Page<ProviderDto>> listProviders(
            @Parameter(name = "sector", description = "Filter by sector (case-insensitive)", in = ParameterIn.QUERY)
            @RequestParam(required = false) String sector,
            @ParameterObject @PageableDefault(size = 100) Pageable pageable
    ) {
        return ResponseEntity.ok(providerService.listProviders(sector, pageable));
    }

    @Operation(summary = "Sector vocabulary", description = "Suggested sectors and the sectors that carry extra booking rules.")
    @GetMapping("/sectors")
    public ResponseEntity<SectorCatalogDto> getSectors() {
        return ResponseEntity.ok(providerService.getSectorCatalog());
    }

    @Operation(summary = "Get provider by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Provider returned",
                    content = @Content(schema = @Schema(implementation = ProviderDto.class))),
            @ApiResponse(responseCode = "404", description = "Provider not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{id}")
    public ResponseEntity<ProviderDto> getProvider(@PathVariable Long id) {
        return ResponseEntity.ok(providerService.getProvider(id));
    }

    @Operation(summary = "Update a provider", description = "Partially updates provider fields, including the active flag.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Provider updated",
                    content = @Content(schema = @Schema(implementation = ProviderDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Provider not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/{id}")
    public ResponseEntity<ProviderDto> updateProvider(
            @PathVariable Long id,
            @Valid @RequestBody UpdateProviderRequest request
    ) {
        return ResponseEntity.ok(providerService.updateProvider(id, request));
    }

    @Operation(summary = "Deactivate a provider")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Provider deactivated",
                    content = @Content(schema = @Schema(implementation = ProviderDto.class))),
            @ApiResponse(responseCode = "404", description = "Provider not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{id}/deactivate")
    public ResponseEntity<ProviderDto> deactivateProvider(@PathVariable Long id) {
        return ResponseEntity.ok(providerService.deactivateProvider(id));
    }

    @Operation(summary = "Delete a provider", description = "Hard delete. Fails with 409 while bookings still reference the provider.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Provider deleted"),
            @ApiResponse(responseCode = "404", description = "Provider not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Provider still has bookings",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteProvider(@PathVariable Long id) {
        providerService.deleteProvider(id);
        return ResponseEntity.noContent().build();
    }
}
