package io.quorum.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.quorum.core.QuorumConfig;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PlanCommandTest extends BaseCommandTest {

    @TempDir Path corpusDir;

    private PlanCommand command;

    @BeforeEach
    void setUp() throws Exception {
        createCorpus(corpusDir);
        command = new PlanCommand();
        injectField(command, "corpusDir", corpusDir);
        injectField(command, "quorumConfig", new QuorumConfig());
        injectField(command, "color", false);
    }

    @Test
    void shouldPrintUnitsAndRoster() {
        int exit = command.call();

        assertThat(exit).isEqualTo(QuorumCommand.EXIT_OK);
        assertThat(out())
                .contains("Plan for " + corpusDir.getFileName() + ": 2 files, 10 lines")
                .contains("U1   api (5 lines)")
                .contains("roles: quality (1.0), implementation (1.0), design (1.2)")
                .contains("2 units, 6 invocations, consensus needs 70% coverage");
    }

    @Test
    void shouldAddComplexityRoleToOversizedUnits() throws Exception {
        write(corpusDir, "legacy/big.py", "x = 1\n".repeat(200));
        write(corpusDir, "util/small.py", "y = 2\n");

        command.call();

        assertThat(out())
                .contains("legacy (200 lines)")
                .contains("oversized, complexity role added")
                .contains("complexity (1.5)")
                .contains("4 units, 13 invocations");
    }

    @Test
    void shouldApplyWeightAndIncludeOverrides() throws Exception {
        injectField(command, "weights", Map.of("design", 2.0));
        injectField(command, "includes", List.of("api/**"));

        command.call();

        assertThat(out())
                .contains("1 files, 5 lines")
                .contains("design (2.0)")
                .doesNotContain("core");
    }

    @Test
    void shouldFailOnInvalidDepth() throws Exception {
        injectField(command, "partitionDepth", 0);

        assertThat(command.call()).isEqualTo(QuorumCommand.EXIT_ERROR);
        assertThat(err()).contains("partitionDepth must be at least 1");
    }
}
