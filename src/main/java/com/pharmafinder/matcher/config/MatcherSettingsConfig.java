package com.pharmafinder.matcher.config;

import com.pharmafinder.matcher.service.CascadeSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MatcherSettingsConfig {

    @Value("${matcher.thresholds.embedding-accept:0.85}")
    private double embeddingAccept;
    @Value("${matcher.thresholds.fuzzy-accept:0.9}")
    private double fuzzyAccept;
    @Value("${matcher.thresholds.trigram-accept:0.6}")
    private double trigramAccept;
    @Value("${matcher.thresholds.default-confidence:0.7}")
    private double defaultConfidence;
    @Value("${matcher.suggestions.limit:5}")
    private int suggestionLimit;
    @Value("${matcher.sentence.max-name-tokens:5}")
    private int maxNameTokens;
    @Value("${matcher.query.max-length:200}")
    private int maxQueryLength;

    @Bean
    public CascadeSettings cascadeSettings() {
        return new CascadeSettings(embeddingAccept, fuzzyAccept, trigramAccept, defaultConfidence,
                Math.max(1, suggestionLimit), Math.max(1, maxNameTokens), Math.max(1, maxQueryLength));
    }
}
