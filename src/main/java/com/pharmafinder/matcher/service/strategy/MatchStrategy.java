package com.pharmafinder.matcher.service.strategy;

import com.pharmafinder.matcher.model.MatchMethod;
import com.pharmafinder.matcher.model.StrategyOutcome;
import com.pharmafinder.matcher.service.MatcherGeneration;

/**
 * One signal source of the matching cascade. Implementations are stateless and report
 * provider problems through {@link StrategyOutcome} rather than by throwing.
 */
public interface MatchStrategy {

    MatchMethod method();

    /**
     * @return whether the strategy can run against the given generation
     */
    boolean isEnabled(MatcherGeneration generation);

    StrategyOutcome search(MatchContext context);
}
