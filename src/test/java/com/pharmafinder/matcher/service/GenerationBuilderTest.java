package com.pharmafinder.matcher.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationBuilderTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private GenerationBuilder builder(EmbeddingProvider provider) {
        return new GenerationBuilder(TestCommunes.NORMALIZER, TestCommunes.ALIAS_DERIVER, provider, 0.2,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void buildsEveryIndex() {
        MatcherGeneration generation = builder(new FixedEmbeddingProvider(true)).build(TestCommunes.valparaisoCoast(), 7);

        assertThat(generation.number()).isEqualTo(7);
        assertThat(generation.builtAt()).isEqualTo(NOW);
        assertThat(generation.gazetteer().size()).isEqualTo(4);
        assertThat(generation.trigramIndex().shingleCount()).isPositive();
        assertThat(generation.fuzzyMatcher().search("quilpue", 0.9)).isNotEmpty();
        assertThat(generation.embeddingIndex()).isPresent();
    }

    @Test
    void unconfiguredProviderLeavesEmbeddingsAbsent() {
        FixedEmbeddingProvider provider = new FixedEmbeddingProvider(false);

        MatcherGeneration generation = builder(provider).build(TestCommunes.valparaisoCoast(), 1);

        assertThat(generation.embeddingIndex()).isEmpty();
        assertThat(provider.calls()).isZero();
    }

    @Test
    void providerFailureLeavesEmbeddingsAbsent() {
        FixedEmbeddingProvider provider = new FixedEmbeddingProvider(true);
        provider.setFailing(true);

        MatcherGeneration generation = builder(provider).build(TestCommunes.valparaisoCoast(), 1);

        assertThat(generation.embeddingIndex()).isEmpty();
        assertThat(generation.gazetteer().exactLookup("valpo")).contains("Valparaíso");
    }
}
