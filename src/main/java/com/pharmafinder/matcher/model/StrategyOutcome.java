package com.pharmafinder.matcher.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed result of running one matching strategy. Provider failures surface as
 * {@link Status#FAILED} or {@link Status#UNAVAILABLE} instead of exceptions so the cascade
 * can skip the strategy explicitly.
 */
public final class StrategyOutcome {

    public enum Status {
        PRODUCED,
        EMPTY,
        UNAVAILABLE,
        FAILED
    }

    private final MatchMethod method;
    private final Status status;
    private final List<ScoredCandidate> candidates;
    private final NormalizedQuery rewrittenQuery;
    private final LocationIntent intent;
    private final String detail;

    private StrategyOutcome(MatchMethod method,
                            Status status,
                            List<ScoredCandidate> candidates,
                            NormalizedQuery rewrittenQuery,
                            LocationIntent intent,
                            String detail) {
        this.method = method;
        this.status = status;
        List<ScoredCandidate> sorted = new ArrayList<>(candidates == null ? List.of() : candidates);
        sorted.sort(ScoredCandidate.BY_SCORE_DESC);
        this.candidates = List.copyOf(sorted);
        this.rewrittenQuery = rewrittenQuery;
        this.intent = intent;
        this.detail = detail;
    }

    public static StrategyOutcome of(MatchMethod method, List<ScoredCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return empty(method);
        }
        return new StrategyOutcome(method, Status.PRODUCED, candidates, null, null, null);
    }

    public static StrategyOutcome empty(MatchMethod method) {
        return new StrategyOutcome(method, Status.EMPTY, List.of(), null, null, null);
    }

    public static StrategyOutcome unavailable(MatchMethod method, String reason) {
        return new StrategyOutcome(method, Status.UNAVAILABLE, List.of(), null, null, reason);
    }

    public static StrategyOutcome failed(MatchMethod method, Throwable cause) {
        String reason = cause == null ? "unknown" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new StrategyOutcome(method, Status.FAILED, List.of(), null, null, reason);
    }

    /**
     * Outcome of a query-rewriting strategy: the interpreted intent, the rewritten working
     * query and any candidates found for it.
     */
    public static StrategyOutcome rewritten(MatchMethod method,
                                            LocationIntent intent,
                                            NormalizedQuery rewrittenQuery,
                                            List<ScoredCandidate> candidates) {
        Status status = candidates == null || candidates.isEmpty() ? Status.EMPTY : Status.PRODUCED;
        return new StrategyOutcome(method, status, candidates, rewrittenQuery, intent, null);
    }

    public MatchMethod method() {
        return method;
    }

    public Status status() {
        return status;
    }

    public List<ScoredCandidate> candidates() {
        return candidates;
    }

    public boolean produced() {
        return status == Status.PRODUCED;
    }

    public Optional<ScoredCandidate> top() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    public Optional<NormalizedQuery> rewrittenQuery() {
        return Optional.ofNullable(rewrittenQuery);
    }

    public Optional<LocationIntent> intent() {
        return Optional.ofNullable(intent);
    }

    public Optional<String> detail() {
        return Optional.ofNullable(detail);
    }

    @Override
    public String toString() {
        return "StrategyOutcome{" + method.wireName() + ", " + status + ", candidates=" + candidates.size()
                + (detail != null ? ", detail=" + detail : "") + "}";
    }
}
