package com.findex.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI findingsExportOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("GuardDuty Findings Export API")
                        .description("Exports GuardDuty findings from selected AWS regions into CSV files")
                        .version("1.0"));
    }
}
