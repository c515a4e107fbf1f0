package com.pharmafinder.matcher.service;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Titan embeddings through {@link BedrockModelGateway}, rate limited and bounded by the
 * provider call timeout.
 */
@Service
public class BedrockEmbeddingProvider implements EmbeddingProvider {

    private final BedrockModelGateway gateway;
    private final BoundedProviderCall boundedCall;
    private final RateLimiter embedRateLimiter;
    private final boolean enabled;

    public BedrockEmbeddingProvider(BedrockModelGateway gateway,
                                    BoundedProviderCall boundedCall,
                                    @Qualifier("embedRateLimiter") RateLimiter embedRateLimiter,
                                    @Value("${matcher.embedding.enabled:false}") boolean enabled) {
        this.gateway = gateway;
        this.boundedCall = boundedCall;
        this.embedRateLimiter = embedRateLimiter;
        this.enabled = enabled;
    }

    @Override
    public boolean isConfigured() {
        return enabled;
    }

    @Override
    @SuppressWarnings("UnstableApiUsage")
    public float[] encode(String text) {
        if (!enabled) {
            throw new SignalUnavailableException("Embedding provider is not configured");
        }
        return boundedCall.call("embedding", () -> {
            embedRateLimiter.acquire();
            try {
                return gateway.generateEmbedding(text);
            } catch (IOException e) {
                throw new SignalUnavailableException("Embedding request failed", e);
            }
        });
    }
}
