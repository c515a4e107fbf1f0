package com.pharmafinder.matcher.service.strategy;

import com.pharmafinder.matcher.model.LocationIntent;
import com.pharmafinder.matcher.model.MatchMethod;
import com.pharmafinder.matcher.model.NormalizedQuery;
import com.pharmafinder.matcher.model.ScoredCandidate;
import com.pharmafinder.matcher.model.StrategyOutcome;
import com.pharmafinder.matcher.service.LocationExtractionService;
import com.pharmafinder.matcher.service.MatcherGeneration;
import com.pharmafinder.matcher.service.RegexLocationExtractor;
import com.pharmafinder.matcher.service.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rewrites a sentence-like query into the location phrase it mentions. The LLM phrase is
 * used when its confidence reaches the acceptance threshold, otherwise the regex fallback
 * phrase. An exact gazetteer hit on the rewritten phrase is reported as a candidate; a
 * sentence without any location phrase rewrites to an empty query.
 */
@Component
public class NlExtractionStrategy implements MatchStrategy {

    private static final Logger logger = LoggerFactory.getLogger(NlExtractionStrategy.class);

    private final LocationExtractionService extractionService;
    private final RegexLocationExtractor fallbackExtractor;
    private final TextNormalizer normalizer;
    private final boolean enabled;
    private final double acceptThreshold;
    private final int sampleSize;

    public NlExtractionStrategy(LocationExtractionService extractionService,
                                RegexLocationExtractor fallbackExtractor,
                                TextNormalizer normalizer,
                                @Value("${matcher.nl-extraction.enabled:true}") boolean enabled,
                                @Value("${matcher.thresholds.nl-accept:0.5}") double acceptThreshold,
                                @Value("${matcher.nl.sample-size:20}") int sampleSize) {
        this.extractionService = extractionService;
        this.fallbackExtractor = fallbackExtractor;
        this.normalizer = normalizer;
        this.enabled = enabled;
        this.acceptThreshold = acceptThreshold;
        this.sampleSize = Math.max(0, sampleSize);
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.NL_EXTRACTED;
    }

    @Override
    public boolean isEnabled(MatcherGeneration generation) {
        return enabled;
    }

    @Override
    public StrategyOutcome search(MatchContext context) {
        List<String> sample = context.generation().gazetteer().mostPopular(sampleSize);
        LocationIntent intent = extractionService.extract(context.originalQuery(), sample);

        String location;
        if (intent.source() == LocationIntent.Source.LLM
                && intent.hasLocation()
                && intent.confidence() >= acceptThreshold) {
            location = intent.extractedLocation();
        } else if (intent.source() == LocationIntent.Source.FALLBACK) {
            location = intent.extractedLocation();
        } else {
            location = fallbackExtractor.extractLocation(context.originalQuery());
        }

        NormalizedQuery rewritten = normalizer.normalize(location);
        if (rewritten.isEmpty()) {
            logger.debug("No location phrase extracted ({})", intent.reasoning());
            return StrategyOutcome.rewritten(MatchMethod.NL_EXTRACTED, intent, rewritten, List.of());
        }
        List<ScoredCandidate> candidates = context.generation().gazetteer()
                .exactLookup(rewritten.normalized())
                .map(commune -> List.of(new ScoredCandidate(commune, 1.0)))
                .orElse(List.of());
        return StrategyOutcome.rewritten(MatchMethod.NL_EXTRACTED, intent, rewritten, candidates);
    }
}
