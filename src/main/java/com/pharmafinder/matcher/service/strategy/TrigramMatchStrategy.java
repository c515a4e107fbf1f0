package com.pharmafinder.matcher.service.strategy;

import com.pharmafinder.matcher.model.MatchMethod;
import com.pharmafinder.matcher.model.StrategyOutcome;
import com.pharmafinder.matcher.service.MatcherGeneration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class TrigramMatchStrategy implements MatchStrategy {

    private final int topK;

    public TrigramMatchStrategy(@Value("${matcher.trigram.top-k:10}") int topK) {
        this.topK = Math.max(1, topK);
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.TRIGRAM;
    }

    @Override
    public boolean isEnabled(MatcherGeneration generation) {
        return true;
    }

    @Override
    public StrategyOutcome search(MatchContext context) {
        return StrategyOutcome.of(MatchMethod.TRIGRAM,
                context.generation().trigramIndex().search(context.workingQuery().normalized(), topK));
    }
}
