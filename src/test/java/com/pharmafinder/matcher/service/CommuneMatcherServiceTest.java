package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.CommuneRecord;
import com.pharmafinder.matcher.model.MatchMethod;
import com.pharmafinder.matcher.model.MatchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommuneMatcherServiceTest {

    private CommuneMatcherService service;

    @BeforeEach
    void setUp() {
        service = newService(TestCommunes.loader("classpath:data/communes.json"));
        service.initialize();
    }

    private CommuneMatcherService newService(ReferenceDataLoader loader) {
        GazetteerRegistry registry = new GazetteerRegistry(TestCommunes.generationBuilder(TestCommunes.noEmbeddings()));
        return new CommuneMatcherService(registry, TestCommunes.cascade(), loader, TestCommunes.NORMALIZER);
    }

    @Test
    void initializeLoadsConfiguredReferenceData() {
        assertThat(service.currentGeneration()).isEqualTo(1);
        assertThat(service.match("Quilpué").method()).isEqualTo(MatchMethod.EXACT);
    }

    @Test
    void missingReferenceDataFailsInitialization() {
        CommuneMatcherService broken = newService(TestCommunes.loader("classpath:data/missing.json"));

        assertThatThrownBy(broken::initialize).isInstanceOf(DataUnavailableException.class);
        assertThatThrownBy(() -> broken.match("Quilpué")).isInstanceOf(DataUnavailableException.class);
    }

    @Test
    void defaultThresholdAcceptsCloseMisspelling() {
        MatchResult result = service.match("kilpue");

        assertThat(result.matchedCommune()).isEqualTo("Quilpué");
        assertThat(result.method()).isEqualTo(MatchMethod.FUZZY);
    }

    @Test
    void thresholdOutsideUnitIntervalIsRejected() {
        assertThatThrownBy(() -> service.match("Quilpué", 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.match("Quilpué", -0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.match("Quilpué", Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void suggestionsPutTheMatchFirst() {
        assertThat(service.suggestions("kilpue", 3)).containsExactly("Quilpué", "Illapel", "Maipú");
        assertThat(service.suggestions("")).containsExactly("Santiago", "Las Condes", "Providencia", "Puente Alto", "Maipú");
        assertThat(service.suggestions("xyz123")).isEmpty();
        assertThat(service.suggestions("kilpue", 0)).isEmpty();
    }

    @Test
    void describeResolvesAliases() {
        assertThat(service.describe("vina")).hasValueSatisfying(record -> {
            assertThat(record.canonicalName()).isEqualTo("Viña del Mar");
            assertThat(record.region()).isEqualTo("Valparaíso");
            assertThat(record.popularity()).isEqualTo(81);
        });
        assertThat(service.describe("Atlantis")).isEmpty();
        assertThat(service.describe(null)).isEmpty();
    }

    @Test
    void reloadReplacesTheGeneration() {
        service.reload(List.of(CommuneRecord.of("Temuco", "La Araucanía")));

        assertThat(service.currentGeneration()).isEqualTo(2);
        assertThat(service.match("Temuco").method()).isEqualTo(MatchMethod.EXACT);
        assertThat(service.match("Quilpué").matchedCommune()).isNotEqualTo("Quilpué");
        assertThat(service.describe("Quilpué")).isEmpty();
    }

    @Test
    void rejectedReloadKeepsServing() {
        assertThatThrownBy(() -> service.reload(List.of())).isInstanceOf(DataUnavailableException.class);

        assertThat(service.currentGeneration()).isEqualTo(1);
        assertThat(service.match("Quilpué").matchedCommune()).isEqualTo("Quilpué");
    }

    @Test
    void reloadFromUnchangedSourceIsSkipped() {
        assertThat(service.reloadFromSource()).isFalse();
        assertThat(service.currentGeneration()).isEqualTo(1);
    }

    @Test
    void reloadFromSourceAfterManualReloadRestoresReferenceData() {
        service.reload(List.of(CommuneRecord.of("Temuco", "La Araucanía")));

        assertThat(service.reloadFromSource()).isTrue();
        assertThat(service.currentGeneration()).isEqualTo(3);
        assertThat(service.match("Quilpué").matchedCommune()).isEqualTo("Quilpué");
    }

    @Test
    void concurrentQueriesNeverMixGenerations() throws Exception {
        List<CommuneRecord> full = TestCommunes.reference();
        List<CommuneRecord> withoutQuilpue = full.stream()
                .filter(record -> !record.canonicalName().equals("Quilpué"))
                .collect(Collectors.toList());
        Map<Long, Boolean> hasQuilpue = new ConcurrentHashMap<>();
        hasQuilpue.put(service.currentGeneration(), true);

        Queue<MatchResult> results = new ConcurrentLinkedQueue<>();
        AtomicBoolean done = new AtomicBoolean(false);
        CountDownLatch readersStarted = new CountDownLatch(4);
        ExecutorService readers = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 4; i++) {
            readers.submit(() -> {
                readersStarted.countDown();
                while (!done.get()) {
                    results.add(service.match("quilpue"));
                }
            });
        }
        readersStarted.await(5, TimeUnit.SECONDS);
        for (int i = 0; i < 20; i++) {
            boolean includeQuilpue = i % 2 == 1;
            service.reload(includeQuilpue ? full : withoutQuilpue);
            hasQuilpue.put(service.currentGeneration(), includeQuilpue);
        }
        done.set(true);
        readers.shutdown();
        assertThat(readers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(results).isNotEmpty();
        for (MatchResult result : results) {
            if (hasQuilpue.get(result.generation())) {
                assertThat(result.matchedCommune()).isEqualTo("Quilpué");
                assertThat(result.method()).isEqualTo(MatchMethod.EXACT);
            } else {
                assertThat(result.matchedCommune()).isNotEqualTo("Quilpué");
            }
        }
    }
}
