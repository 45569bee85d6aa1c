package com.ospicorp.forecastengine.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("!extract")
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Forecast Engine API")
            .version("v1")
            .description("Forecasts cluster resource metrics from submitted history")
            .contact(new Contact().name("Cluster Capacity Team").email("capacity@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .externalDocs(new ExternalDocumentation()
            .description("Error reference")
            .url("https://docs.forecast-engine.dev/errors/"));
  }
}
