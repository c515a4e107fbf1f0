package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.CommuneRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GazetteerTest {

    @Test
    void resolvesCanonicalExplicitAndDerivedAliases() {
        Gazetteer gazetteer = TestCommunes.gazetteer(TestCommunes.valparaisoCoast());

        assertThat(gazetteer.exactLookup("quilpue")).contains("Quilpué");
        assertThat(gazetteer.exactLookup("valpo")).contains("Valparaíso");
        assertThat(gazetteer.exactLookup("v alemana")).contains("Villa Alemana");
        assertThat(gazetteer.exactLookup("vina")).contains("Viña del Mar");
        assertThat(gazetteer.exactLookup("concepcion")).isEmpty();
        assertThat(gazetteer.exactLookup("")).isEmpty();
    }

    @Test
    void canonicalNameWinsOverDerivedAlias() {
        Gazetteer gazetteer = TestCommunes.gazetteer(List.of(
                CommuneRecord.of("La Florida", "Metropolitana de Santiago"),
                CommuneRecord.of("Florida", "Biobío")));

        assertThat(gazetteer.exactLookup("florida")).contains("Florida");
        assertThat(gazetteer.exactLookup("la florida")).contains("La Florida");
        assertThat(gazetteer.record("La Florida").orElseThrow().aliases()).doesNotContain("Florida");
    }

    @Test
    void derivedAliasClaimedByTwoCommunesIsDropped() {
        Gazetteer gazetteer = TestCommunes.gazetteer(List.of(
                CommuneRecord.of("La Estrella", "O'Higgins"),
                CommuneRecord.of("Las Estrella", "Ficticia")));

        assertThat(gazetteer.exactLookup("estrella")).isEmpty();
        assertThat(gazetteer.exactLookup("la estrella")).contains("La Estrella");
        assertThat(gazetteer.exactLookup("las estrella")).contains("Las Estrella");
    }

    @Test
    void recordsCarryDerivedAliases() {
        Gazetteer gazetteer = TestCommunes.gazetteer(TestCommunes.valparaisoCoast());

        CommuneRecord quilpue = gazetteer.record("Quilpué").orElseThrow();
        assertThat(quilpue.region()).isEqualTo("Valparaíso");
        assertThat(quilpue.aliases()).contains("Quilpue", "quilpue");
        assertThat(gazetteer.aliasesOf("Villa Alemana")).containsExactlyInAnyOrder("villa alemana", "v alemana");
    }

    @Test
    void mostPopularOrdersByPharmacyCount() {
        Gazetteer gazetteer = TestCommunes.gazetteer(TestCommunes.valparaisoCoast());

        assertThat(gazetteer.mostPopular(3)).containsExactly("Viña del Mar", "Valparaíso", "Quilpué");
        assertThat(gazetteer.mostPopular(10)).hasSize(4);
        assertThat(gazetteer.mostPopular(0)).isEmpty();
    }

    @Test
    void emptyReferenceDataIsRejected() {
        assertThatThrownBy(() -> TestCommunes.gazetteer(List.of()))
                .isInstanceOf(DataUnavailableException.class);
    }

    @Test
    void duplicateCanonicalNameIsRejected() {
        List<CommuneRecord> records = List.of(
                new CommuneRecord("Quilpué", "Valparaíso", Set.of(), 1),
                new CommuneRecord("Quilpué", "Valparaíso", Set.of(), 2));

        assertThatThrownBy(() -> TestCommunes.gazetteer(records))
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("Quilpué");
    }
}
