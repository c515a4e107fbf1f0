package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.ScoredCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EmbeddingIndexTest {

    @Test
    void communeScoresBestAliasCosine() {
        FixedEmbeddingProvider provider = new FixedEmbeddingProvider(true)
                .sameDirection(0, "vina", "ciudad jardin");
        EmbeddingIndex index = EmbeddingIndex.build(TestCommunes.gazetteer(TestCommunes.valparaisoCoast()), provider);

        List<ScoredCandidate> results = index.search(provider.encode("ciudad jardin"), 5);

        assertThat(results).containsExactly(new ScoredCandidate("Viña del Mar", 1.0));
    }

    @Test
    void eachDistinctAliasIsEncodedOnce() {
        FixedEmbeddingProvider provider = new FixedEmbeddingProvider(true);
        Gazetteer gazetteer = TestCommunes.gazetteer(TestCommunes.valparaisoCoast());

        EmbeddingIndex index = EmbeddingIndex.build(gazetteer, provider);

        assertThat(provider.calls()).isEqualTo(gazetteer.allAliases().size());
        assertThat(index.communeCount()).isEqualTo(4);
        assertThat(index.dimension()).isEqualTo(FixedEmbeddingProvider.DIMENSION);
    }

    @Test
    void providerFailureAbortsTheBuild() {
        FixedEmbeddingProvider provider = new FixedEmbeddingProvider(true);
        provider.setFailing(true);

        assertThatThrownBy(() -> EmbeddingIndex.build(TestCommunes.gazetteer(TestCommunes.valparaisoCoast()), provider))
                .isInstanceOf(SignalUnavailableException.class);
    }

    @Test
    void mismatchedQueryVectorYieldsNothing() {
        EmbeddingIndex index = EmbeddingIndex.build(TestCommunes.gazetteer(TestCommunes.valparaisoCoast()),
                new FixedEmbeddingProvider(true));

        assertThat(index.search(new float[3], 5)).isEmpty();
        assertThat(index.search(null, 5)).isEmpty();
    }

    @Test
    void cosineOfParallelAndOrthogonalVectors() {
        assertThat(EmbeddingIndex.cosine(new float[]{1, 2, 3}, new float[]{2, 4, 6})).isCloseTo(1.0, within(1e-6));
        assertThat(EmbeddingIndex.cosine(new float[]{1, 0}, new float[]{0, 1})).isZero();
        assertThat(EmbeddingIndex.cosine(new float[]{0, 0}, new float[]{0, 1})).isZero();
    }
}
