package uk.gegc.frontdesk.shared.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Utility", description = "Utility endpoints")
@RequiredArgsConstructor
public class UtilityController {

    private final HealthEndpoint healthEndpoint;

    @Operation(
            summary = "Health-check endpoint",
            description = "Returns `{ \"status\": \"UP\" }` with the database component when the service can serve bookings"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Service and its database are up",
                    content = @Content(
                            mediaType = "application/json",
                            schema = @Schema(
                                    implementation = HealthComponent.class,
                                    example = "{\"status\":\"UP\"}"
                            )
                    )
            ),
            @ApiResponse(responseCode = "503", description = "Service or database is down")
    })
    @GetMapping("/health")
    public ResponseEntity<HealthComponent> health() {
        HealthComponent health = healthEndpoint.health();
        HttpStatus status = Status.UP.equals(health.getStatus()) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }
}
