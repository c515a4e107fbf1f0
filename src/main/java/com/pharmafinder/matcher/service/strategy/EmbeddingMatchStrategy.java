package com.pharmafinder.matcher.service.strategy;

import com.pharmafinder.matcher.model.MatchMethod;
import com.pharmafinder.matcher.model.StrategyOutcome;
import com.pharmafinder.matcher.service.EmbeddingIndex;
import com.pharmafinder.matcher.service.EmbeddingProvider;
import com.pharmafinder.matcher.service.MatcherGeneration;
import com.pharmafinder.matcher.service.SignalUnavailableException;
import com.pharmafinder.matcher.service.ThrottledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class EmbeddingMatchStrategy implements MatchStrategy {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingMatchStrategy.class);

    private final EmbeddingProvider embeddingProvider;
    private final int topK;

    public EmbeddingMatchStrategy(EmbeddingProvider embeddingProvider,
                                  @Value("${matcher.embedding.top-k:5}") int topK) {
        this.embeddingProvider = embeddingProvider;
        this.topK = Math.max(1, topK);
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.EMBEDDING;
    }

    @Override
    public boolean isEnabled(MatcherGeneration generation) {
        return embeddingProvider.isConfigured() && generation.embeddingIndex().isPresent();
    }

    @Override
    public StrategyOutcome search(MatchContext context) {
        Optional<EmbeddingIndex> index = context.generation().embeddingIndex();
        if (index.isEmpty() || !embeddingProvider.isConfigured()) {
            return StrategyOutcome.unavailable(MatchMethod.EMBEDDING, "embedding index absent");
        }
        try {
            float[] queryVector = embeddingProvider.encode(context.workingQuery().normalized());
            return StrategyOutcome.of(MatchMethod.EMBEDDING, index.get().search(queryVector, topK));
        } catch (SignalUnavailableException | ThrottledException e) {
            logger.debug("Embedding signal unavailable: {}", e.getMessage());
            return StrategyOutcome.failed(MatchMethod.EMBEDDING, e);
        }
    }
}
