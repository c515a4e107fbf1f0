package com.pharmafinder.matcher.service.strategy;

import com.pharmafinder.matcher.model.MatchMethod;
import com.pharmafinder.matcher.model.StrategyOutcome;
import com.pharmafinder.matcher.service.MatcherGeneration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Runs the fuzzy matcher once at the suggestion floor; the cascade applies the higher
 * acceptance thresholds to the same candidate list.
 */
@Component
public class FuzzyMatchStrategy implements MatchStrategy {

    private final double floor;

    public FuzzyMatchStrategy(@Value("${matcher.thresholds.fuzzy-suggest:0.3}") double floor) {
        this.floor = floor;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.FUZZY;
    }

    @Override
    public boolean isEnabled(MatcherGeneration generation) {
        return true;
    }

    @Override
    public StrategyOutcome search(MatchContext context) {
        return StrategyOutcome.of(MatchMethod.FUZZY,
                context.generation().fuzzyMatcher().search(context.workingQuery().normalized(), floor));
    }
}
