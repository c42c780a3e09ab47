package uk.gegc.frontdesk.features.booking.api;

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
import org.springframework.format.annotation.DateTimeFormat;
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
import uk.gegc.frontdesk.features.booking.api.dto.BookingDto;
import uk.gegc.frontdesk.features.booking.api.dto.CreateBookingRequest;
import uk.gegc.frontdesk.features.booking.api.dto.UpdateBookingRequest;
import uk.gegc.frontdesk.features.booking.application.BookingService;
import uk.gegc.frontdesk.features.booking.domain.model.BookingSearchCriteria;
import uk.gegc.frontdesk.features.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
@Tag(name = "Bookings", description = "Booking creation, lifecycle and search")
public class BookingController {

    private final BookingService bookingService;

    @Operation(
            summary = "Create a booking",
            description = "Validates the provider reference, the schedule and the provider's sector rule, then stores the booking as pending."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Booking created",
                    content = @Content(schema = @Schema(implementation = BookingDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error or unknown provider",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<BookingDto> createBooking(@Valid @RequestBody CreateBookingRequest request) {
        BookingDto created = bookingService.createBooking(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "List bookings", description = "Ordered by scheduled time; from/to bounds are inclusive.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of bookings returned"),
            @ApiResponse(responseCode = "400", description = "Invalid filter value",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public ResponseEntity<Page<BookingDto>> listBookings(
            @Parameter(name = "providerId", description = "Filter by provider", in = ParameterIn.QUERY)
            @RequestParam(required = false) Long providerId,
            @Parameter(name = "status", description = "Filter by status", in = ParameterIn.QUERY,
                    schema = @Schema(allowableValues = {"pending", "confirmed", "completed", "cancelled"}))
            @RequestParam(required = false) BookingStatus status,
            @Parameter(name = "from", description = "Earliest scheduled time (inclusive)", in = ParameterIn.QUERY)
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @Parameter(name = "to", description = "Latest scheduled time (inclusive)", in = ParameterIn.QUERY)
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @ParameterObject @PageableDefault(size = 100) Pageable pageable
    ) {
        BookingSearchCriteria criteria = new BookingSearchCriteria(providerId, status, from, to);
        return ResponseEntity.ok(bookingService.listBookings(criteria, pageable));
    }

    @Operation(summary = "Get booking by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Booking returned",
                    content = @Content(schema = @Schema(implementation = BookingDto.class))),
            @ApiResponse(responseCode = "404", description = "Booking not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{id}")
    public ResponseEntity<BookingDto> getBooking(@PathVariable Long id) {
        return ResponseEntity.ok(bookingService.getBooking(id));
    }

    @Operation(
            summary = "Update a booking",
            description = "Partially updates client data, schedule or notes; a status value requests a lifecycle transition."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Booking updated",
                    content = @Content(schema = @Schema(implementation = BookingDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Booking not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Status transition not allowed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/{id}")
    public ResponseEntity<BookingDto> updateBooking(
            @PathVariable Long id,
            @Valid @RequestBody UpdateBookingRequest request
    ) {
        return ResponseEntity.ok(bookingService.updateBooking(id, request));
    }

    @Operation(summary = "Cancel a booking", description = "Allowed from pending or confirmed only.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Booking cancelled",
                    content = @Content(schema = @Schema(implementation = BookingDto.class))),
            @ApiResponse(responseCode = "404", description = "Booking not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Booking already completed or cancelled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{id}/cancel")
    public ResponseEntity<BookingDto> cancelBooking(@PathVariable Long id) {
        return ResponseEntity.ok(bookingService.cancelBooking(id));
    }

    @Operation(summary = "Delete a booking", description = "Hard delete, regardless of status.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Booking deleted"),
            @ApiResponse(responseCode = "404", description = "Booking not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteBooking(@PathVariable Long id) {
        bookingService.deleteBooking(id);
        return ResponseEntity.noContent().build();
    }
}
