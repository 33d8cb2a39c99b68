package io.quorum.core.consensus;

/// Measures how alike two finding descriptions are, from `0.0` to `1.0`.
@FunctionalInterface
public interface FindingSimilarity {

    double similarity(String a, String b);
}
