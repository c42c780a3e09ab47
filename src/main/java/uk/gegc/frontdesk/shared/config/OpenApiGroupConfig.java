package uk.gegc.frontdesk.shared.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per feature.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public OpenAPI frontDeskOpenApi() {
        return new OpenAPI().info(new Info()
                .title("Multi-Sector Front Desk API")
                .description("Providers and bookings across medical, real estate, automotive and other sectors")
                .version("v1"));
    }

    @Bean
    public GroupedOpenApi providersGroup() {
        return GroupedOpenApi.builder()
                .group("providers")
                .displayName("Providers")
                .pathsToMatch("/api/v1/providers/**")
                .build();
    }

    @Bean
    public GroupedOpenApi bookingsGroup() {
        return GroupedOpenApi.builder()
                .group("bookings")
                .displayName("Bookings")
                .pathsToMatch("/api/v1/bookings/**")
                .build();
    }

    @Bean
    public GroupedOpenApi utilityGroup() {
        return GroupedOpenApi.builder()
                .group("utility")
                .displayName("Utility")
                .pathsToMatch("/api/v1/health")
                .build();
    }
}
