package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.CommuneRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active {@link MatcherGeneration}. Readers never lock; installs build the new
 * generation completely before swapping the reference.
 */
@Component
public class GazetteerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(GazetteerRegistry.class);

    private final GenerationBuilder generationBuilder;
    private final AtomicReference<MatcherGeneration> active = new AtomicReference<>();
    private final AtomicLong generationCounter = new AtomicLong();
    private final Object installLock = new Object();

    public GazetteerRegistry(GenerationBuilder generationBuilder) {
        this.generationBuilder = generationBuilder;
    }

    /**
     * Builds and activates a new generation. On failure the previous generation stays active.
     *
     * @throws DataUnavailableException when the records cannot form a gazetteer
     */
    public MatcherGeneration install(Collection<CommuneRecord> records) {
        synchronized (installLock) {
            MatcherGeneration next = generationBuilder.build(records, generationCounter.get() + 1);
            generationCounter.incrementAndGet();
            MatcherGeneration previous = active.getAndSet(next);
            logger.info("Activated generation {} ({} communes){}", next.number(), next.gazetteer().size(),
                    previous != null ? ", replacing generation " + previous.number() : "");
            return next;
        }
    }

    /**
     * @throws DataUnavailableException when no generation has been installed yet
     */
    public MatcherGeneration current() {
        MatcherGeneration generation = active.get();
        if (generation == null) {
            throw new DataUnavailableException("No commune gazetteer has been loaded");
        }
        return generation;
    }

    public boolean isReady() {
        return active.get() != null;
    }
}
