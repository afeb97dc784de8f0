package com.example.datalake.kbsearch.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "Knowledge Search API",
        version = "v1",
        description = "Hybrid tag and vector search over knowledge bases."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("Knowledge Search API")
            .version("v1")
            .description("Search chunks of the caller's knowledge bases by tag filters, query similarity, or both.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi knowledgeApi() {
    return GroupedOpenApi.builder()
        .group("knowledge")
        .packagesToScan("com.example.datalake.kbsearch.controller")
        .pathsToMatch("/api/v1/**")
        .build();
  }

  @Bean
  public GroupedOpenApi actuatorApi() {
    return GroupedOpenApi.builder()
        .group("actuator")
        .pathsToMatch("/actuator/**")
        .build();
  }
}
