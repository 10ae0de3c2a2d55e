package com.mermaidbuilder.cli;

import com.mermaidbuilder.MermaidBuilderCLI;
import com.mermaidbuilder.core.config.DiagramAssembler;
import com.mermaidbuilder.core.config.DiagramDefinition;
import com.mermaidbuilder.core.config.DiagramDefinitionLoader;
import com.mermaidbuilder.core.graph.Diagram;
import com.mermaidbuilder.core.graph.DiagramValidationException;
import com.mermaidbuilder.core.renderer.DiagramRenderers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to render a YAML diagram definition to Mermaid text.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print to stdout
 * mermaid-builder render orders.yaml
 *
 * # Write to a file, creating parent directories
 * mermaid-builder render orders.yaml -o docs/orders.mmd
 * }</pre>
 */
@Command(
    name = "render",
    description = "Render a YAML diagram definition to Mermaid text",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Parameters(
        index = "0",
        description = "Diagram definition file (YAML)"
    )
    private Path definitionPath;

    @Option(
        names = {"-o", "--output"},
        description = "Output file (default: stdout)"
    )
    private Path outputPath;

    @ParentCommand
    private MermaidBuilderCLI parent;

    @Override
    public Integer call() {
        try {
            log.info("Rendering diagram definition: {}", definitionPath);

            DiagramDefinition definition = DiagramDefinitionLoader.load(definitionPath);
            Diagram<?, ?> diagram = DiagramAssembler.assemble(definition);
            String text = DiagramRenderers.render(diagram);

            if (outputPath == null) {
                System.out.print(text);
            } else {
                writeOutput(text);
                if (!isQuiet()) {
                    System.out.println("✓ Wrote " + diagram.type() + " diagram to: " + outputPath);
                }
            }

            log.info("Rendered {} diagram with {} nodes and {} edges",
                diagram.type(), diagram.nodes().size(), diagram.edges().size());
            return 0;

        } catch (DiagramValidationException | IllegalArgumentException e) {
            log.error("Invalid diagram definition {}: {}", definitionPath, e.getMessage());
            System.err.println("✗ Invalid diagram definition: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to render {}", definitionPath, e);
            System.err.println("✗ Render failed: " + e.getMessage());
            return 1;
        }
    }

    private boolean isQuiet() {
        return parent != null && parent.isQuiet();
    }

    private void writeOutput(String text) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, text, StandardCharsets.UTF_8);
        log.debug("Wrote {} characters to: {}", text.length(), outputPath);
    }
}
