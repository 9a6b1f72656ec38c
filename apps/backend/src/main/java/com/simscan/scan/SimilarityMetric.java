package com.simscan.scan;

/**
 * Pure, symmetric similarity score between two text bodies.
 */
public interface SimilarityMetric {

    /**
     * @return a score in [0, 1]; 1 means identical
     */
    double similarity(String a, String b);
}
