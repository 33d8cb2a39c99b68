package io.quorum.core.consensus;

/// Decides whether two findings describe the same issue.
///
/// Findings match when they point at the same resource, ignoring line numbers, and
/// their descriptions are at least `threshold` similar.
public class FindingMatcher {

    private final FindingSimilarity similarity;
    private final double threshold;

    public FindingMatcher(FindingSimilarity similarity, double threshold) {
        this.similarity = similarity;
        this.threshold = threshold;
    }

    public boolean matches(Finding a, Finding b) {
        return a.resourcePath().equals(b.resourcePath())
                && similarity.similarity(a.description(), b.description()) >= threshold;
    }
}
