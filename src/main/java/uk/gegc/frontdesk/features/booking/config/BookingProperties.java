package uk.gegc.frontdesk.features.booking.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.booking")
public class BookingProperties {

    /**
     * First hour (inclusive) a laboratory booking may start.
     */
    @Min(0)
    @Max(23)
    private int laboratoryOpeningHour = 8;

    /**
     * Hour (exclusive) after which laboratory bookings are refused.
     */
    @Min(1)
    @Max(24)
    private int laboratoryClosingHour = 18;

    /**
     * Text that transportation booking notes must contain.
     */
    @NotBlank
    private String pickupKeyword = "pickup";

    /**
     * Text that hospitality booking notes must contain.
     */
    @NotBlank
    private String checkOutKeyword = "check-out";

    /**
     * Refuse new bookings for providers that have been deactivated.
     */
    private boolean rejectInactiveProviders = false;
}
