package com.tfigtfs.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

        @Bean
        public OpenAPI tfiGtfsOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("TFI GTFS API documentation")
                                                .description(
                                                                "### TFI GTFS departures API\n\n" +
                                                                                "Keeps the Transport for Ireland GTFS static timetable and GTFS-Realtime trip updates "
                                                                                +
                                                                                "fresh in memory and answers departure queries by stop number.\n\n"
                                                                                +
                                                                                "#### Key Features:\n" +
                                                                                "- **Departures**: Timetabled departures adjusted with real-time delays, cancellations and skipped stops.\n"
                                                                                +
                                                                                "- **Service Calendar**: Services running on each day of the expansion window.\n"
                                                                                +
                                                                                "- **Feed Status**: Download agent state, last fetch result and snapshot timestamps.")
                                                .version("v1.0.0")
                                                .license(new License()
                                                                .name("Apache 2.0")
                                                                .url("http://springdoc.org")))
                                .servers(List.of(
                                                new Server().url("http://localhost:8080")
                                                                .description("Local Development (HTTP)")));
        }
}
