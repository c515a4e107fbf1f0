package com.pharmafinder.matcher.service.strategy;

import com.pharmafinder.matcher.model.MatchMethod;
import com.pharmafinder.matcher.model.ScoredCandidate;
import com.pharmafinder.matcher.model.StrategyOutcome;
import com.pharmafinder.matcher.service.MatcherGeneration;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ExactMatchStrategy implements MatchStrategy {

    @Override
    public MatchMethod method() {
        return MatchMethod.EXACT;
    }

    @Override
    public boolean isEnabled(MatcherGeneration generation) {
        return true;
    }

    @Override
    public StrategyOutcome search(MatchContext context) {
        return context.generation().gazetteer()
                .exactLookup(context.workingQuery().normalized())
                .map(commune -> StrategyOutcome.of(MatchMethod.EXACT, List.of(new ScoredCandidate(commune, 1.0))))
                .orElseGet(() -> StrategyOutcome.empty(MatchMethod.EXACT));
    }
}
