package com.mermaidbuilder;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link MermaidBuilderCLI} global options.
 */
class MermaidBuilderCLITest {

    private final ch.qos.logback.classic.Logger root =
        (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void tearDown() {
        root.setLevel(Level.INFO);
    }

    @Test
    void verbose_setsDebugLevelBeforeSubcommandRuns() {
        int exitCode = MermaidBuilderCLI.createCommandLine().execute("-v", "list", "shapes");

        assertThat(exitCode).isZero();
        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void quiet_setsErrorLevel() {
        int exitCode = MermaidBuilderCLI.createCommandLine().execute("-q");

        assertThat(exitCode).isZero();
        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void help_returnsZero() {
        assertThat(MermaidBuilderCLI.createCommandLine().execute("--help")).isZero();
    }
}
