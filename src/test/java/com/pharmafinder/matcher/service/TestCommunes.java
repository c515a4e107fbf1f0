package com.pharmafinder.matcher.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import com.pharmafinder.matcher.model.CommuneRecord;
import com.pharmafinder.matcher.service.strategy.EmbeddingMatchStrategy;
import com.pharmafinder.matcher.service.strategy.ExactMatchStrategy;
import com.pharmafinder.matcher.service.strategy.FuzzyMatchStrategy;
import com.pharmafinder.matcher.service.strategy.NlExtractionStrategy;
import com.pharmafinder.matcher.service.strategy.TrigramMatchStrategy;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Set;

import static org.mockito.Mockito.mock;

/**
 * Shared wiring for tests that run the matcher without a Spring context.
 */
public final class TestCommunes {

    public static final TextNormalizer NORMALIZER = new TextNormalizer();
    public static final AliasDeriver ALIAS_DERIVER = new AliasDeriver(NORMALIZER);
    public static final RegexLocationExtractor REGEX_EXTRACTOR = new RegexLocationExtractor(NORMALIZER);

    private TestCommunes() {
    }

    public static ReferenceDataLoader loader(String location) {
        return new ReferenceDataLoader(new DefaultResourceLoader(), new ObjectMapper(), new ContentHashingService(), location);
    }

    /**
     * The bundled reference file, the same one the application loads.
     */
    public static List<CommuneRecord> reference() {
        return loader("classpath:data/communes.json").load().records();
    }

    public static List<CommuneRecord> valparaisoCoast() {
        return List.of(
                new CommuneRecord("Quilpué", "Valparaíso", Set.of(), 29),
                new CommuneRecord("Villa Alemana", "Valparaíso", Set.of("V. Alemana"), 24),
                new CommuneRecord("Viña del Mar", "Valparaíso", Set.of("Viña"), 81),
                new CommuneRecord("Valparaíso", "Valparaíso", Set.of("Valpo"), 68)
        );
    }

    public static Gazetteer gazetteer(List<CommuneRecord> records) {
        return Gazetteer.build(records, NORMALIZER, ALIAS_DERIVER);
    }

    public static GenerationBuilder generationBuilder(EmbeddingProvider provider) {
        return new GenerationBuilder(NORMALIZER, ALIAS_DERIVER, provider, 0.2);
    }

    public static MatcherGeneration generation(List<CommuneRecord> records, EmbeddingProvider provider) {
        return generationBuilder(provider).build(records, 1);
    }

    public static MatcherGeneration generation(List<CommuneRecord> records) {
        return generation(records, noEmbeddings());
    }

    public static EmbeddingProvider noEmbeddings() {
        return new FixedEmbeddingProvider(false);
    }

    /**
     * Location extraction with the LLM switched off, so only the regex fallback answers.
     */
    public static LocationExtractionService regexOnlyExtraction() {
        return new LocationExtractionService(
                mock(BedrockModelGateway.class),
                mock(BoundedProviderCall.class),
                new ObjectMapper(),
                new LocationIntentValidator(),
                REGEX_EXTRACTOR,
                RateLimiter.create(100),
                false);
    }

    public static MatchingCascade cascade(LocationExtractionService extraction, EmbeddingProvider provider) {
        return new MatchingCascade(
                NORMALIZER,
                new SuggestionRanker(),
                new NlExtractionStrategy(extraction, REGEX_EXTRACTOR, NORMALIZER, true, 0.5, 20),
                new ExactMatchStrategy(),
                new EmbeddingMatchStrategy(provider, 5),
                new FuzzyMatchStrategy(0.3),
                new TrigramMatchStrategy(10),
                CascadeSettings.defaults());
    }

    public static MatchingCascade cascade() {
        return cascade(regexOnlyExtraction(), noEmbeddings());
    }
}
