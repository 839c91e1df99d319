package com.tennis.tracker.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI matchTrackerOpenAPI(@Value("${server.port:8080}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Tennis Match Tracker")
                        .description("Record a singles match point by point: serve, return and rally outcomes. " +
                                "Score, serve rotation, tiebreaks and statistics are kept by the engine; " +
                                "matches can be exported as text, JSON or CSV.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local")
                ));
    }
}
