package com.pharmafinder.matcher.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates LLM location responses against {@code schemas/location_intent.schema.json}.
 */
@Component
public class LocationIntentValidator {

    static final String SCHEMA_PATH = "schemas/location_intent.schema.json";

    private final JsonSchema schema;

    public LocationIntentValidator() {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        try (InputStream in = new ClassPathResource(SCHEMA_PATH).getInputStream()) {
            this.schema = factory.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load " + SCHEMA_PATH, e);
        }
    }

    /**
     * @return human-readable violations; empty when the response is valid
     */
    public Set<String> validate(JsonNode response) {
        if (response == null || !response.isObject()) {
            return Set.of("response is not a JSON object");
        }
        Set<ValidationMessage> messages = schema.validate(response);
        return messages.stream().map(ValidationMessage::getMessage).collect(Collectors.toSet());
    }
}
