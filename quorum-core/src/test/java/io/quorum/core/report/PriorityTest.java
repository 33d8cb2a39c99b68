package io.quorum.core.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.quorum.core.consensus.ConsensusLevel;
import io.quorum.core.consensus.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PriorityTest {

    @ParameterizedTest
    @CsvSource({
        "CRITICAL, UNANIMOUS, P1",
        "CRITICAL, MAJORITY, P2",
        "HIGH, UNANIMOUS, P2",
        "HIGH, MAJORITY, P3",
        "MEDIUM, UNANIMOUS, P4",
        "LOW, MAJORITY, P5",
        "INFO, UNANIMOUS, P5"
    })
    void shouldMapSeverityAndLevelToTier(Severity severity, ConsensusLevel level, Priority expected) {
        assertThat(Priority.of(severity, level)).isEqualTo(expected);
    }

    @Test
    void shouldRefuseMinorityFindings() {
        assertThatThrownBy(() -> Priority.of(Severity.HIGH, ConsensusLevel.MINORITY))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
