package com.lynkvertx.primecee.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI (Swagger) Configuration
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI primeCeeOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Prime CEE API")
                .description("Energy-saving certificate (CEE) valorisation of renovation projects")
                .version("0.1.0"));
    }
}
