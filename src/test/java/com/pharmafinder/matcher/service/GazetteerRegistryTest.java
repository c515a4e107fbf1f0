package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.CommuneRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GazetteerRegistryTest {

    private final GazetteerRegistry registry =
            new GazetteerRegistry(TestCommunes.generationBuilder(TestCommunes.noEmbeddings()));

    @Test
    void currentFailsBeforeFirstInstall() {
        assertThat(registry.isReady()).isFalse();
        assertThatThrownBy(registry::current).isInstanceOf(DataUnavailableException.class);
    }

    @Test
    void installSwapsInNumberedGenerations() {
        MatcherGeneration first = registry.install(TestCommunes.valparaisoCoast());
        MatcherGeneration second = registry.install(List.of(CommuneRecord.of("Temuco", "La Araucanía")));

        assertThat(first.number()).isEqualTo(1);
        assertThat(second.number()).isEqualTo(2);
        assertThat(registry.current()).isSameAs(second);
        assertThat(first.gazetteer().exactLookup("quilpue")).contains("Quilpué");
        assertThat(second.gazetteer().exactLookup("quilpue")).isEmpty();
    }

    @Test
    void failedInstallKeepsPreviousGeneration() {
        MatcherGeneration first = registry.install(TestCommunes.valparaisoCoast());

        assertThatThrownBy(() -> registry.install(List.of())).isInstanceOf(DataUnavailableException.class);

        assertThat(registry.current()).isSameAs(first);
        assertThat(registry.install(TestCommunes.valparaisoCoast()).number()).isEqualTo(2);
    }
}
