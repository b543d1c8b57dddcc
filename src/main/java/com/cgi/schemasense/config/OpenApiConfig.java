package com.cgi.schemasense.config;

import com.cgi.schemasense.model.enums.Regulation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.stream.Collectors;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI schemaSenseOpenAPI(ClassificationProperties properties) {
        String regulations = Arrays.stream(Regulation.values())
                .map(Regulation::name)
                .collect(Collectors.joining(", "));
        String description = "Classifies database schema columns by data sensitivity. Supported regulations: "
                + regulations + ". At most " + Math.round(properties.getOrchestration().getAiCeiling() * 100)
                + "% of a schema's columns are escalated to the AI service.";

        return new OpenAPI()
                .info(new Info()
                        .title("SchemaSense API")
                        .version("1.0")
                        .description(description)
                        .contact(new Contact().name("CGI").url("https://www.cgi.com")))
                .addTagsItem(new Tag().name("Schema Classification")
                        .description("Hybrid pattern and AI classification of schema columns"));
    }
}
