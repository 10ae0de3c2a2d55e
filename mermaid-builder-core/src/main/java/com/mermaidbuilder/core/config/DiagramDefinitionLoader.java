package com.mermaidbuilder.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Utility for loading {@link DiagramDefinition}s from YAML files.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DiagramDefinition definition = DiagramDefinitionLoader.load(Path.of("checkout.yaml"));
 * Diagram<?, ?> diagram = DiagramAssembler.assemble(definition);
 * String text = DiagramRenderers.render(diagram);
 * }</pre>
 */
public final class DiagramDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(DiagramDefinitionLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DiagramDefinitionLoader() {
        // Utility class
    }

    /**
     * Loads a diagram definition from a YAML file.
     *
     * @param path path to the definition file
     * @return parsed definition
     * @throws IOException if the file is missing, unreadable, empty or not valid YAML
     */
    public static DiagramDefinition load(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }

        log.debug("Loading diagram definition from: {}", path);
        DiagramDefinition definition = YAML_MAPPER.readValue(path.toFile(), DiagramDefinition.class);
        if (definition == null) {
            throw new IOException("Diagram definition is empty: " + path);
        }
        log.info("Loaded {} definition with {} nodes and {} edges from: {}",
            definition.type(), definition.nodes().size(), definition.edges().size(), path);
        return definition;
    }

    /**
     * Parses a diagram definition from YAML text.
     *
     * @param yaml YAML document
     * @return parsed definition
     * @throws IOException if the text is empty or not valid YAML
     */
    public static DiagramDefinition parse(String yaml) throws IOException {
        Objects.requireNonNull(yaml, "yaml must not be null");
        DiagramDefinition definition = YAML_MAPPER.readValue(yaml, DiagramDefinition.class);
        if (definition == null) {
            throw new IOException("Diagram definition is empty");
        }
        return definition;
    }
}
