package com.clausescan.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI clauseScanOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("ClauseScan API")
                        .description("Rule-based legal document classification, risk scoring, red flag detection "
                                + "and pre-signing checklists")
                        .version("1.0.0")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")));
    }
}
