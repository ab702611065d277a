package com.ospicorp.capacityforecast.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Capacity Forecast API")
            .version("v1")
            .description("Backtests baseline forecasting models, selects the most accurate one, "
                + "forecasts with prediction intervals and raises capacity alerts")
            .contact(new Contact().name("Capacity Planning Team").email("capacity-support@example.com")))
        .servers(List.of(new Server().url("/")))
        .externalDocs(new ExternalDocumentation()
            .description("Error reference")
            .url(ApiExceptionHandler.PROBLEM_TYPE_BASE));
  }
}
