package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.CommuneRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;

/**
 * Builds every index of a generation from reference records. Only an empty gazetteer is
 * fatal; an embedding provider failure leaves the embedding capability absent.
 */
@Component
public class GenerationBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GenerationBuilder.class);

    private final TextNormalizer normalizer;
    private final AliasDeriver aliasDeriver;
    private final EmbeddingProvider embeddingProvider;
    private final double substringBonus;
    private final Clock clock;

    @Autowired
    public GenerationBuilder(TextNormalizer normalizer,
                             AliasDeriver aliasDeriver,
                             EmbeddingProvider embeddingProvider,
                             @Value("${matcher.fuzzy.substring-bonus:0.2}") double substringBonus) {
        this(normalizer, aliasDeriver, embeddingProvider, substringBonus, Clock.systemUTC());
    }

    GenerationBuilder(TextNormalizer normalizer,
                      AliasDeriver aliasDeriver,
                      EmbeddingProvider embeddingProvider,
                      double substringBonus,
                      Clock clock) {
        this.normalizer = normalizer;
        this.aliasDeriver = aliasDeriver;
        this.embeddingProvider = embeddingProvider;
        this.substringBonus = substringBonus;
        this.clock = clock;
    }

    /**
     * @throws DataUnavailableException when the records are empty or inconsistent
     */
    public MatcherGeneration build(Collection<CommuneRecord> records, long number) {
        long started = System.nanoTime();
        Gazetteer gazetteer = Gazetteer.build(records, normalizer, aliasDeriver);
        TrigramIndex trigramIndex = TrigramIndex.build(gazetteer);
        FuzzyMatcher fuzzyMatcher = new FuzzyMatcher(gazetteer, substringBonus);
        EmbeddingIndex embeddingIndex = buildEmbeddingIndex(gazetteer, number);

        logger.info("Generation {} built in {} ms: {} communes, {} trigrams, embeddings {}",
                number, (System.nanoTime() - started) / 1_000_000, gazetteer.size(),
                trigramIndex.shingleCount(), embeddingIndex != null ? "enabled" : "absent");
        return new MatcherGeneration(number, clock.instant(), gazetteer, trigramIndex, fuzzyMatcher, embeddingIndex);
    }

    private EmbeddingIndex buildEmbeddingIndex(Gazetteer gazetteer, long number) {
        if (!embeddingProvider.isConfigured()) {
            return null;
        }
        try {
            return EmbeddingIndex.build(gazetteer, embeddingProvider);
        } catch (SignalUnavailableException | ThrottledException e) {
            logger.warn("Embedding index unavailable for generation {}: {}", number, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            logger.warn("Embedding index failed for generation {}", number, e);
            return null;
        }
    }
}
