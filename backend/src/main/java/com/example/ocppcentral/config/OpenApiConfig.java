package com.example.ocppcentral.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI ocppCentralOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("OCPP Central System API")
                        .version("1.0.0")
                        .description("Charge point connections, remote commands and billing (OCPP 1.6)"));
    }

    @Bean
    public GroupedOpenApi allApi() {
        return GroupedOpenApi.builder()
                .group("all")
                .pathsToMatch("/api/**")
                .build();
    }

    @Bean
    public GroupedOpenApi chargePointsApi() {
        return GroupedOpenApi.builder()
                .group("charge-points")
                .pathsToMatch("/api/charge-points/**", "/api/chargers/**")
                .build();
    }

    @Bean
    public GroupedOpenApi transactionsApi() {
        return GroupedOpenApi.builder()
                .group("transactions")
                .pathsToMatch("/api/transactions/**")
                .build();
    }

    @Bean
    public GroupedOpenApi logsApi() {
        return GroupedOpenApi.builder()
                .group("logs")
                .pathsToMatch("/api/logs/**")
                .build();
    }
}
