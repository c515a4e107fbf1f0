package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.LocationIntent;
import com.pharmafinder.matcher.model.MatchMethod;
import com.pharmafinder.matcher.model.MatchResult;
import com.pharmafinder.matcher.model.NormalizedQuery;
import com.pharmafinder.matcher.model.ScoredCandidate;
import com.pharmafinder.matcher.model.StrategyOutcome;
import com.pharmafinder.matcher.service.strategy.EmbeddingMatchStrategy;
import com.pharmafinder.matcher.service.strategy.ExactMatchStrategy;
import com.pharmafinder.matcher.service.strategy.FuzzyMatchStrategy;
import com.pharmafinder.matcher.service.strategy.MatchContext;
import com.pharmafinder.matcher.service.strategy.MatchStrategy;
import com.pharmafinder.matcher.service.strategy.NlExtractionStrategy;
import com.pharmafinder.matcher.service.strategy.TrigramMatchStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered composition of the matching strategies. Runs against a single captured
 * generation and stops at the first strategy whose best candidate clears its acceptance
 * threshold:
 * <ol>
 *     <li>empty query: no match, most popular communes as suggestions</li>
 *     <li>sentence-like query: location extraction rewrites the working query; no location
 *     phrase at all ends like an empty query, with the intent attached</li>
 *     <li>exact alias lookup</li>
 *     <li>embedding similarity</li>
 *     <li>fuzzy similarity at the fuzzy threshold</li>
 *     <li>trigram similarity</li>
 *     <li>fuzzy similarity at the caller's confidence threshold</li>
 *     <li>no match, merged suggestions from every strategy that ran</li>
 * </ol>
 */
@Service
public class MatchingCascade {

    private static final Logger logger = LoggerFactory.getLogger(MatchingCascade.class);

    private final TextNormalizer normalizer;
    private final SuggestionRanker ranker;
    private final NlExtractionStrategy nlStrategy;
    private final ExactMatchStrategy exactStrategy;
    private final EmbeddingMatchStrategy embeddingStrategy;
    private final FuzzyMatchStrategy fuzzyStrategy;
    private final TrigramMatchStrategy trigramStrategy;
    private final CascadeSettings settings;

    public MatchingCascade(TextNormalizer normalizer,
                           SuggestionRanker ranker,
                           NlExtractionStrategy nlStrategy,
                           ExactMatchStrategy exactStrategy,
                           EmbeddingMatchStrategy embeddingStrategy,
                           FuzzyMatchStrategy fuzzyStrategy,
                           TrigramMatchStrategy trigramStrategy,
                           CascadeSettings settings) {
        this.normalizer = normalizer;
        this.ranker = ranker;
        this.nlStrategy = nlStrategy;
        this.exactStrategy = exactStrategy;
        this.embeddingStrategy = embeddingStrategy;
        this.fuzzyStrategy = fuzzyStrategy;
        this.trigramStrategy = trigramStrategy;
        this.settings = settings;
    }

    public CascadeSettings settings() {
        return settings;
    }

    public MatchResult match(MatcherGeneration generation, String query, double confidenceThreshold) {
        return match(generation, query, confidenceThreshold, settings.suggestionLimit());
    }

    /**
     * Resolves {@code query} against {@code generation}. Provider failures degrade to the
     * next strategy; the only exception path is an unexpected error in the caller's thread.
     */
    public MatchResult match(MatcherGeneration generation,
                             String query,
                             double confidenceThreshold,
                             int suggestionLimit) {
        String original = query == null ? "" : query;
        String bounded = bounded(original);
        NormalizedQuery normalized = normalizer.normalize(bounded);
        Gazetteer gazetteer = generation.gazetteer();

        if (normalized.isEmpty()) {
            return new MatchResult(original, "", null, 0.0, MatchMethod.NONE,
                    gazetteer.mostPopular(suggestionLimit), null, generation.number());
        }

        MatchContext context = new MatchContext(generation, bounded, normalized);
        LocationIntent intent = null;

        if (nlStrategy.isEnabled(generation) && isSentence(normalized, gazetteer)) {
            StrategyOutcome extraction = run(nlStrategy, context);
            intent = extraction.intent().orElse(null);
            Optional<NormalizedQuery> rewritten = extraction.rewrittenQuery();
            if (rewritten.isPresent() && rewritten.get().isEmpty()) {
                logger.debug("No location in '{}'", original);
                return new MatchResult(original, normalized.normalized(), null, 0.0, MatchMethod.NONE,
                        gazetteer.mostPopular(suggestionLimit), intent, generation.number());
            }
            if (rewritten.isPresent()) {
                context = context.withWorkingQuery(rewritten.get());
                logger.debug("Query '{}' rewritten to '{}'", original, rewritten.get().normalized());
            }
            Optional<ScoredCandidate> extracted = extraction.top();
            if (extracted.isPresent()) {
                return accept(original, context, extracted.get(), MatchMethod.NL_EXTRACTED, List.of(), intent,
                        suggestionLimit);
            }
        }

        StrategyOutcome exact = run(exactStrategy, context);
        if (exact.top().isPresent()) {
            return accept(original, context, exact.top().get(), MatchMethod.EXACT, List.of(), intent, suggestionLimit);
        }

        List<StrategyOutcome> seen = new ArrayList<>();

        if (embeddingStrategy.isEnabled(generation)) {
            StrategyOutcome embedding = run(embeddingStrategy, context);
            seen.add(embedding);
            Optional<ScoredCandidate> top = accepted(embedding, settings.embeddingAccept());
            if (top.isPresent()) {
                return accept(original, context, top.get(), MatchMethod.EMBEDDING, seen, intent, suggestionLimit);
            }
        }

        StrategyOutcome fuzzy = run(fuzzyStrategy, context);
        seen.add(fuzzy);
        Optional<ScoredCandidate> fuzzyTop = accepted(fuzzy, settings.fuzzyAccept());
        if (fuzzyTop.isPresent()) {
            return accept(original, context, fuzzyTop.get(), MatchMethod.FUZZY, seen, intent, suggestionLimit);
        }

        StrategyOutcome trigram = run(trigramStrategy, context);
        seen.add(trigram);
        Optional<ScoredCandidate> trigramTop = accepted(trigram, settings.trigramAccept());
        if (trigramTop.isPresent()) {
            return accept(original, context, trigramTop.get(), MatchMethod.TRIGRAM, seen, intent, suggestionLimit);
        }

        Optional<ScoredCandidate> looseFuzzy = accepted(fuzzy, confidenceThreshold);
        if (looseFuzzy.isPresent()) {
            return accept(original, context, looseFuzzy.get(), MatchMethod.FUZZY, seen, intent, suggestionLimit);
        }

        double bestScore = 0.0;
        List<List<ScoredCandidate>> candidateLists = new ArrayList<>();
        for (StrategyOutcome outcome : seen) {
            candidateLists.add(outcome.candidates());
            if (outcome.top().isPresent()) {
                bestScore = Math.max(bestScore, outcome.top().get().score());
            }
        }
        List<String> suggestions = ranker.rank(candidateLists, null, suggestionLimit);
        logger.debug("No match for '{}' (best score {}); {} suggestions", original, bestScore, suggestions.size());
        return new MatchResult(original, context.workingQuery().normalized(), null, bestScore, MatchMethod.NONE,
                suggestions, intent, generation.number());
    }

    /**
     * A query reads as a sentence when it is not itself a known alias and carries intent
     * words, a leading preposition or more tokens than any commune name.
     */
    boolean isSentence(NormalizedQuery normalized, Gazetteer gazetteer) {
        if (gazetteer.exactLookup(normalized.normalized()).isPresent()) {
            return false;
        }
        return SpanishQueryLexicon.looksLikeSentence(normalized.tokens(), settings.maxNameTokens());
    }

    private String bounded(String query) {
        int max = settings.maxQueryLength();
        return query.length() > max ? query.substring(0, max) : query;
    }

    private MatchResult accept(String original,
                               MatchContext context,
                               ScoredCandidate winner,
                               MatchMethod method,
                               List<StrategyOutcome> seen,
                               LocationIntent intent,
                               int suggestionLimit) {
        List<List<ScoredCandidate>> candidateLists = new ArrayList<>();
        for (StrategyOutcome outcome : seen) {
            candidateLists.add(outcome.candidates());
        }
        List<String> suggestions = ranker.rank(candidateLists, winner.commune(), suggestionLimit);
        double confidence = switch (method) {
            case EXACT, NL_EXTRACTED -> 1.0;
            case EMBEDDING, FUZZY, TRIGRAM -> winner.score();
            case NONE -> 0.0;
        };
        logger.debug("Matched '{}' to {} via {} ({})", original, winner.commune(),
                method.wireName(), confidence);
        return new MatchResult(original, context.workingQuery().normalized(), winner.commune(),
                confidence, method, suggestions, intent, context.generation().number());
    }

    private static Optional<ScoredCandidate> accepted(StrategyOutcome outcome, double threshold) {
        return outcome.top().filter(top -> top.score() >= threshold);
    }

    private StrategyOutcome run(MatchStrategy strategy, MatchContext context) {
        try {
            StrategyOutcome outcome = strategy.search(context);
            if (outcome.status() == StrategyOutcome.Status.FAILED || outcome.status() == StrategyOutcome.Status.UNAVAILABLE) {
                logger.debug("Strategy {} skipped: {}", strategy.method().wireName(), outcome.detail().orElse(""));
            }
            return outcome;
        } catch (SignalUnavailableException | ThrottledException e) {
            logger.warn("Strategy {} unavailable: {}", strategy.method().wireName(), e.getMessage());
            return StrategyOutcome.failed(strategy.method(), e);
        }
    }
}
