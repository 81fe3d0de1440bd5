package com.z254.gridpulse.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for GRIDPULSE service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI gridPulseOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("GRIDPULSE API")
                        .description("""
                                GRIDPULSE - streaming power-demand analysis.

                                Runs a multi-step analysis pipeline per query and streams partial results
                                as they become available.

                                ## Features
                                - **Forecast analysis**: demand history, influence factors, forecast, change points and anomaly zones
                                - **News and report questions**: search or retrieval followed by a streamed answer
                                - **Resumable streams**: every event is logged and can be replayed from a sequence number
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8090").description("Local development")
                ));
    }
}
