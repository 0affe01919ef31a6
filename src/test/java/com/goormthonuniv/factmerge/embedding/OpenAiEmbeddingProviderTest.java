package com.goormthonuniv.factmerge.embedding;

import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OpenAiEmbeddingProviderTest {

    @Test
    void vectorsFollowResponseIndexAndAreNormalized() {
        OpenAiEmbeddingProvider.EmbeddingResponse res = new OpenAiEmbeddingProvider.EmbeddingResponse();
        res.data = List.of(item(1, List.of(0.0, 2.0)), item(0, List.of(3.0, 4.0)));

        List<double[]> vectors = OpenAiEmbeddingProvider.toVectors(res, 2);

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)[0]).isCloseTo(0.6, within(1e-9));
        assertThat(vectors.get(1)[1]).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void countMismatchIsMalformed() {
        OpenAiEmbeddingProvider.EmbeddingResponse res = new OpenAiEmbeddingProvider.EmbeddingResponse();
        res.data = List.of(item(0, List.of(1.0)));
        assertThat(OpenAiEmbeddingProvider.toVectors(res, 2)).isNull();
        assertThat(OpenAiEmbeddingProvider.toVectors(null, 1)).isNull();
    }

    @Test
    void unreachableServiceFallsBackToLocalVectors() {
        TermVectorEmbeddingProvider local = new TermVectorEmbeddingProvider(64);
        OpenAiEmbeddingProvider remote = new OpenAiEmbeddingProvider(RestClient.create(),
                "http://127.0.0.1:1/v1/embeddings", "sk-test", "text-embedding-3-small", local);

        List<double[]> vectors = remote.embedAll(List.of("solar output rose", "wind capacity doubled"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)).isEqualTo(local.embed("solar output rose"));
    }

    private static OpenAiEmbeddingProvider.EmbeddingItem item(int index, List<Double> embedding) {
        OpenAiEmbeddingProvider.EmbeddingItem i = new OpenAiEmbeddingProvider.EmbeddingItem();
        i.index = index;
        i.embedding = embedding;
        return i;
    }
}
