package me.golemcore.archivist.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityClustererTest {

    private final SimilarityClusterer clusterer = new SimilarityClusterer();

    @Test
    void chainedGroupReportsWeakestPairNotLinkingThreshold() {
        double[][] similarity = {
                { 1.0, 0.9, 0.3 },
                { 0.9, 1.0, 0.9 },
                { 0.3, 0.9, 1.0 }
        };

        List<SimilarityClusterer.Cluster> clusters = clusterer.cluster(similarity, 0.7);

        assertEquals(1, clusters.size());
        assertEquals(List.of(0, 1, 2), clusters.get(0).members());
        assertEquals(0.3, clusters.get(0).minSimilarity(), 1e-9);
    }

    @Test
    void confidenceNeverExceedsAnyPair() {
        double[][] similarity = {
                { 1.0, 0.8, 0.75, 0.1 },
                { 0.8, 1.0, 0.72, 0.1 },
                { 0.75, 0.72, 1.0, 0.2 },
                { 0.1, 0.1, 0.2, 1.0 }
        };

        SimilarityClusterer.Cluster cluster = clusterer.cluster(similarity, 0.7).get(0);

        for (int a : cluster.members()) {
            for (int b : cluster.members()) {
                if (a != b) {
                    assertTrue(cluster.minSimilarity() <= similarity[a][b]);
                }
            }
        }
        assertEquals(0.72, cluster.minSimilarity(), 1e-9);
    }

    @Test
    void singletonsAreNotReported() {
        double[][] similarity = {
                { 1.0, 0.2, 0.95, 0.1 },
                { 0.2, 1.0, 0.1, 0.1 },
                { 0.95, 0.1, 1.0, 0.1 },
                { 0.1, 0.1, 0.1, 1.0 }
        };

        List<SimilarityClusterer.Cluster> clusters = clusterer.cluster(similarity, 0.7);

        assertEquals(1, clusters.size());
        assertEquals(List.of(0, 2), clusters.get(0).members());
    }

    @Test
    void thresholdIsInclusive() {
        double[][] similarity = {
                { 1.0, 0.7 },
                { 0.7, 1.0 }
        };

        assertEquals(1, clusterer.cluster(similarity, 0.7).size());
    }

    @Test
    void emptyMatrixGivesNoClusters() {
        assertTrue(clusterer.cluster(new double[0][0], 0.7).isEmpty());
    }
}
