package com.pharmafinder.matcher.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Handles all interactions with Amazon Bedrock: Titan embeddings for the embedding matcher
 * and chat completions for location extraction.
 */
@Service
public class BedrockModelGateway {

    private static final Logger logger = LoggerFactory.getLogger(BedrockModelGateway.class);

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final String chatModelId;
    private final String embeddingModelId;
    private final int bedrockMaxTokens;
    private final int maxAttempts;

    /**
     * @param bedrockClient    shared runtime client (stateless connection pool)
     * @param objectMapper     JSON mapper shared across the application
     * @param chatModelId      Bedrock model id used for chat completions
     * @param embeddingModelId model id used for embedding generation
     * @param bedrockMaxTokens maximum tokens allowed in chat responses
     * @param maxAttempts      attempts per call when Bedrock throttles
     */
    public BedrockModelGateway(BedrockRuntimeClient bedrockClient,
                               ObjectMapper objectMapper,
                               @Value("${aws.bedrock.modelId:anthropic.claude-3-haiku-20240307-v1:0}") String chatModelId,
                               @Value("${aws.bedrock.embeddingModelId:amazon.titan-embed-text-v2:0}") String embeddingModelId,
                               @Value("${app.bedrock.maxTokens:256}") int bedrockMaxTokens,
                               @Value("${app.bedrock.maxAttempts:3}") int maxAttempts) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.chatModelId = chatModelId;
        this.embeddingModelId = embeddingModelId;
        this.bedrockMaxTokens = Math.max(64, bedrockMaxTokens);
        this.maxAttempts = Math.max(1, maxAttempts);
        logger.info("BedrockModelGateway initialized with chat model {} and embedding model {}", chatModelId, embeddingModelId);
    }

    public String getChatModelId() {
        return chatModelId;
    }

    public String getEmbeddingModelId() {
        return embeddingModelId;
    }

    /**
     * Generates a vector embedding for the provided text using the configured embedding model.
     *
     * @param text input text to embed
     * @return float vector representation
     * @throws IOException when the Bedrock call fails or the response cannot be parsed
     */
    public float[] generateEmbedding(String text) throws IOException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("inputText", text);

        InvokeModelRequest request = InvokeModelRequest.builder()
                .modelId(embeddingModelId)
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                .build();

        try {
            InvokeModelResponse response = invokeWithRetry(request, true);
            JsonNode responseJson = objectMapper.readTree(response.body().asUtf8String());
            JsonNode embeddingNode = responseJson.get("embedding");
            if (embeddingNode == null || !embeddingNode.isArray() || embeddingNode.isEmpty()) {
                throw new IOException("Bedrock embedding response has no embedding array");
            }
            float[] embedding = new float[embeddingNode.size()];
            for (int i = 0; i < embeddingNode.size(); i++) {
                embedding[i] = embeddingNode.get(i).floatValue();
            }
            return embedding;
        } catch (ThrottledException te) {
            throw te;
        } catch (BedrockRuntimeException e) {
            logger.error("Bedrock API error during embedding generation: {}", errorMessage(e));
            throw new IOException("Bedrock API error during embedding generation.", e);
        }
    }

    /**
     * Calls Bedrock chat completion and returns the first text block with any code fences removed.
     *
     * @param systemPrompt optional system instruction, may be {@code null}
     * @param content      user message
     * @param maxTokens    overrides the configured max tokens when non-null
     * @param temperature  sampling temperature
     */
    public String invokeChatForText(String systemPrompt, String content, Integer maxTokens, double temperature) {
        int effectiveMaxTokens = maxTokens != null ? Math.max(64, maxTokens) : this.bedrockMaxTokens;
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("anthropic_version", "bedrock-2023-05-31");
            payload.put("max_tokens", effectiveMaxTokens);
            payload.put("temperature", temperature);
            if (systemPrompt != null && !systemPrompt.isBlank()) {
                payload.put("system", systemPrompt);
            }
            List<ObjectNode> messages = new ArrayList<>();
            ObjectNode userMessage = objectMapper.createObjectNode();
            userMessage.put("role", "user");
            userMessage.put("content", content);
            messages.add(userMessage);
            payload.set("messages", objectMapper.valueToTree(messages));

            InvokeModelRequest request = InvokeModelRequest.builder()
                    .modelId(chatModelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                    .build();

            InvokeModelResponse response = invokeWithRetry(request, false);
            JsonNode responseJson = objectMapper.readTree(response.body().asUtf8String());
            JsonNode contentBlock = responseJson.path("content");

            if (contentBlock.isArray() && contentBlock.size() > 0) {
                return stripCodeFences(contentBlock.get(0).path("text").asText(""));
            }
            throw new SignalUnavailableException("Bedrock response missing content block");
        } catch (ThrottledException | SignalUnavailableException e) {
            throw e;
        } catch (BedrockRuntimeException e) {
            logger.warn("Bedrock API error during chat invoke for model {}: {}", chatModelId, errorMessage(e));
            throw new SignalUnavailableException("Bedrock API error during chat invoke", e);
        } catch (Exception e) {
            throw new SignalUnavailableException("Unexpected error during chat invoke: " + e.getMessage(), e);
        }
    }

    static String stripCodeFences(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("```json")) {
            trimmed = trimmed.substring(7).trim();
            if (trimmed.endsWith("```")) {
                trimmed = trimmed.substring(0, trimmed.length() - 3).trim();
            }
        } else if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
        }
        return trimmed;
    }

    /**
     * Invokes Bedrock with exponential backoff on throttling, surfacing exhaustion as
     * {@link ThrottledException}. Interruption (query cancelled) aborts the backoff.
     */
    private InvokeModelResponse invokeWithRetry(InvokeModelRequest request, boolean isEmbedding) {
        final long baseBackoffMs = isEmbedding ? 200L : 400L;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return bedrockClient.invokeModel(request);
            } catch (BedrockRuntimeException e) {
                int statusCode = e.statusCode();
                String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
                boolean throttled = statusCode == 429
                        || "ThrottlingException".equalsIgnoreCase(code)
                        || "TooManyRequestsException".equalsIgnoreCase(code)
                        || "ProvisionedThroughputExceededException".equalsIgnoreCase(code);

                if (!throttled) {
                    throw e;
                }
                if (attempt == maxAttempts) {
                    logger.warn("Bedrock throttled after {} attempts; surfacing throttling.", maxAttempts);
                    throw new ThrottledException("Bedrock throttling after retries", e);
                }

                long jitter = ThreadLocalRandom.current().nextLong(50, 200);
                long sleepMs = (long) Math.min(4_000, baseBackoffMs * Math.pow(2, attempt - 1) + jitter);
                logger.warn("Bedrock throttled (attempt {}/{}). Backing off for {} ms. Error: {}",
                        attempt, maxAttempts, sleepMs, errorMessage(e));
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SignalUnavailableException("Interrupted during backoff", ie);
                }
            }
        }
        throw new IllegalStateException("Unreachable");
    }

    private static String errorMessage(BedrockRuntimeException e) {
        return e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
    }
}
