package com.mermaidbuilder.cli;

import com.mermaidbuilder.MermaidBuilderCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void list_dialects_showsDiscoveredRenderers() {
        int exitCode = MermaidBuilderCLI.createCommandLine().execute("list", "dialects");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("Mermaid Flowchart Renderer (ID: flowchart)")
            .contains("Mermaid Class Diagram Renderer (ID: class)")
            .contains("Mermaid Entity-Relationship Renderer (ID: er)")
            .contains("File Extension: .mmd");
    }

    @Test
    void list_shapes_showsTokens() {
        int exitCode = MermaidBuilderCLI.createCommandLine().execute("list", "shapes");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .containsPattern("RECTANGLE\\s+rect")
            .containsPattern("HORIZONTAL_CYLINDER\\s+das");
    }

    @Test
    void list_arrows_showsBothDialects() {
        int exitCode = MermaidBuilderCLI.createCommandLine().execute("list", "arrows");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("Flowchart Arrows:")
            .containsPattern("NORMAL\\s+--->")
            .contains("Class Diagram Arrows:")
            .containsPattern("TRIANGLE\\s+--\\|>");
    }

    @Test
    void list_cardinalities_showsLeftAndRightTokens() {
        int exitCode = MermaidBuilderCLI.createCommandLine().execute("list", "cardinalities");

        assertThat(exitCode).isZero();
        assertThat(stdout()).containsPattern("ONE_OR_MORE\\s+\\}\\| / \\|\\{");
    }

    @ParameterizedTest
    @ValueSource(strings = {"scanners", "colors"})
    void list_unknownType_returnsOne(String type) {
        int exitCode = MermaidBuilderCLI.createCommandLine().execute("list", type);

        assertThat(exitCode).isEqualTo(1);
    }

    private String stdout() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }
}
