package io.quorum.core.consensus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.quorum.core.roster.WorkerRole;
import java.util.EnumSet;
import org.junit.jupiter.api.Test;

class TokenJaccardSimilarityTest {

    private final TokenJaccardSimilarity similarity = new TokenJaccardSimilarity();

    @Test
    void shouldIgnoreCaseAndPunctuation() {
        double score = similarity.similarity("Missing null check on user", "missing null-check for user");

        assertThat(score).isCloseTo(4.0 / 6.0, within(1e-9));
    }

    @Test
    void shouldScoreDisjointTextsAsZero() {
        assertThat(similarity.similarity("unused import", "race condition")).isZero();
    }

    @Test
    void shouldTreatTwoEmptyTextsAsIdentical() {
        assertThat(similarity.similarity("", "--")).isEqualTo(1.0);
        assertThat(similarity.similarity("word", null)).isZero();
    }

    @Test
    void shouldMatchOnlyFindingsOnSameResource() {
        FindingMatcher matcher = new FindingMatcher(similarity, 0.5);
        Finding a = new Finding("U1", Severity.LOW, "src/a.py:10", "unused import", "", EnumSet.of(WorkerRole.QUALITY));
        Finding b = new Finding("U1", Severity.LOW, "src/a.py:14", "unused import os", "", EnumSet.of(WorkerRole.DESIGN));
        Finding c = new Finding("U1", Severity.LOW, "src/b.py:10", "unused import", "", EnumSet.of(WorkerRole.DESIGN));

        assertThat(matcher.matches(a, b)).isTrue();
        assertThat(matcher.matches(a, c)).isFalse();
    }
}
