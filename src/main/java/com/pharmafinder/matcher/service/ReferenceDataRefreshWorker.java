package com.pharmafinder.matcher.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically re-reads the commune reference data and swaps in a new generation when the
 * content hash changes.
 */
@Service
public class ReferenceDataRefreshWorker {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceDataRefreshWorker.class);

    private final CommuneMatcherService matcherService;
    private final boolean workerEnabled;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ReferenceDataRefreshWorker(CommuneMatcherService matcherService,
                                      @Value("${matcher.reference-data.refresh.enabled:false}") boolean workerEnabled) {
        this.matcherService = matcherService;
        this.workerEnabled = workerEnabled;
    }

    @Scheduled(fixedDelayString = "${matcher.reference-data.refresh.poll-delay-ms:300000}",
            initialDelayString = "${matcher.reference-data.refresh.poll-delay-ms:300000}")
    public void pollReferenceData() {
        if (!workerEnabled) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            logger.debug("Reference data refresh already running; skipping tick.");
            return;
        }
        try {
            if (matcherService.reloadFromSource()) {
                logger.info("Reference data changed; now serving generation {}", matcherService.currentGeneration());
            }
        } catch (DataUnavailableException e) {
            logger.warn("Reference data refresh rejected, keeping generation {}: {}",
                    matcherService.currentGeneration(), e.getMessage());
        } finally {
            running.set(false);
        }
    }
}
