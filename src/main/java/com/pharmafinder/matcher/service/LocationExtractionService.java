package com.pharmafinder.matcher.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import com.pharmafinder.matcher.model.IntentType;
import com.pharmafinder.matcher.model.LocationIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

/**
 * Extracts the location phrase and intent of a natural-language pharmacy request with an
 * LLM, falling back to {@link RegexLocationExtractor} on any failure. Never throws.
 */
@Service
public class LocationExtractionService {

    private static final Logger log = LoggerFactory.getLogger(LocationExtractionService.class);

    static final String PROMPT_PATH = "prompts/location_extraction_prompt.txt";
    private static final String SYSTEM_PROMPT =
            "Eres un experto en análisis de texto para extraer ubicaciones en consultas sobre farmacias en Chile.";
    private static final int MAX_RESPONSE_TOKENS = 200;
    private static final double TEMPERATURE = 0.1;

    private final BedrockModelGateway gateway;
    private final BoundedProviderCall boundedCall;
    private final ObjectMapper objectMapper;
    private final LocationIntentValidator validator;
    private final RegexLocationExtractor fallbackExtractor;
    private final RateLimiter chatRateLimiter;
    private final boolean llmEnabled;
    private final String promptTemplate;

    public LocationExtractionService(BedrockModelGateway gateway,
                                     BoundedProviderCall boundedCall,
                                     ObjectMapper objectMapper,
                                     LocationIntentValidator validator,
                                     RegexLocationExtractor fallbackExtractor,
                                     @Qualifier("chatRateLimiter") RateLimiter chatRateLimiter,
                                     @Value("${matcher.llm.enabled:false}") boolean llmEnabled) {
        this.gateway = gateway;
        this.boundedCall = boundedCall;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.fallbackExtractor = fallbackExtractor;
        this.chatRateLimiter = chatRateLimiter;
        this.llmEnabled = llmEnabled;
        this.promptTemplate = loadPromptTemplate();
        if (!llmEnabled) {
            log.info("LLM location extraction disabled; regex fallback only");
        }
    }

    public boolean isLlmEnabled() {
        return llmEnabled;
    }

    /**
     * @param query          full user sentence
     * @param knownCommunes  sample of canonical names included in the prompt for grounding
     * @return the LLM interpretation, or the regex fallback interpretation when the LLM is
     *         disabled, times out, errors or answers outside the schema
     */
    @SuppressWarnings("UnstableApiUsage")
    public LocationIntent extract(String query, List<String> knownCommunes) {
        if (!StringUtils.hasText(query)) {
            return fallbackExtractor.extract(query, "empty query");
        }
        if (!llmEnabled) {
            return fallbackExtractor.extract(query, "llm disabled");
        }

        // user text goes in last so placeholders inside it stay literal
        String prompt = promptTemplate
                .replace("{known_communes}", String.join(", ", knownCommunes))
                .replace("{user_message}", query.replace("\"", "'"));
        try {
            String rawResponse = boundedCall.call("location-extraction", () -> {
                chatRateLimiter.acquire();
                return gateway.invokeChatForText(SYSTEM_PROMPT, prompt, MAX_RESPONSE_TOKENS, TEMPERATURE);
            });
            JsonNode root = objectMapper.readTree(rawResponse);
            Set<String> violations = validator.validate(root);
            if (!violations.isEmpty()) {
                log.warn("LLM location response rejected by schema: {}", violations);
                return fallbackExtractor.extract(query, "schema violation");
            }
            LocationIntent intent = new LocationIntent(
                    query,
                    root.path("extracted_location").asText(""),
                    IntentType.fromWireName(root.path("intent_type").asText(null)),
                    root.path("confidence").asDouble(0.0),
                    root.path("reasoning").asText(""),
                    LocationIntent.Source.LLM
            );
            log.debug("LLM extracted '{}' ({}, confidence {}): {}", intent.extractedLocation(),
                    intent.intentType().wireName(), intent.confidence(), intent.reasoning());
            return intent;
        } catch (SignalUnavailableException | ThrottledException e) {
            log.warn("LLM location extraction unavailable, using regex fallback: {}", e.getMessage());
            return fallbackExtractor.extract(query, e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("LLM location response is not valid JSON, using regex fallback: {}", e.getOriginalMessage());
            return fallbackExtractor.extract(query, "malformed response");
        } catch (RuntimeException e) {
            log.error("Unexpected error during LLM location extraction, using regex fallback", e);
            return fallbackExtractor.extract(query, "unexpected error");
        }
    }

    private String loadPromptTemplate() {
        try {
            ClassPathResource resource = new ClassPathResource(PROMPT_PATH);
            byte[] bytes = resource.getInputStream().readAllBytes();
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to load location extraction prompt template: {}", e.getMessage());
            return "Extrae la comuna de Chile mencionada en la consulta y responde solo con JSON con las claves "
                    + "extracted_location, intent_type (pharmacy_search|location_query|general), confidence, reasoning.\n"
                    + "Comunas conocidas: {known_communes}\n\nConsulta: \"{user_message}\"";
        }
    }
}
