package com.pharmafinder.matcher.service;

/**
 * Text-to-vector encoder backing the embedding matcher. Implementations must be
 * deterministic for identical input and safe for concurrent use.
 */
public interface EmbeddingProvider {

    /**
     * @return whether the provider is configured; an unconfigured provider is never called
     */
    boolean isConfigured();

    /**
     * @throws SignalUnavailableException when the provider cannot produce a vector
     */
    float[] encode(String text);
}
