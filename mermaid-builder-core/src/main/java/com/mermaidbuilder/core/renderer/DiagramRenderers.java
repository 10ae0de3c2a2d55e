package com.mermaidbuilder.core.renderer;

import com.mermaidbuilder.core.graph.Diagram;
import com.mermaidbuilder.core.model.DiagramType;
import com.mermaidbuilder.core.model.EdgeDescriptor;
import com.mermaidbuilder.core.model.NodeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Registry of {@link DiagramRenderer} implementations discovered via {@link ServiceLoader}.
 */
public final class DiagramRenderers {

    private static final Logger log = LoggerFactory.getLogger(DiagramRenderers.class);

    private static final Map<DiagramType, DiagramRenderer<?, ?>> RENDERERS = discover();

    private DiagramRenderers() {
        // Utility class
    }

    /**
     * Returns the renderer registered for a dialect.
     *
     * @param type dialect
     * @return matching renderer
     * @throws IllegalStateException if no renderer is registered for the dialect
     */
    public static DiagramRenderer<?, ?> forType(DiagramType type) {
        Objects.requireNonNull(type, "type must not be null");
        DiagramRenderer<?, ?> renderer = RENDERERS.get(type);
        if (renderer == null) {
            throw new IllegalStateException("No renderer registered for diagram type: " + type);
        }
        return renderer;
    }

    /**
     * Renders a diagram with the renderer registered for its dialect.
     *
     * @param diagram finalized diagram
     * @return Mermaid source text
     */
    @SuppressWarnings("unchecked")
    public static <N extends NodeDescriptor, E extends EdgeDescriptor> String render(Diagram<N, E> diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        DiagramRenderer<N, E> renderer = (DiagramRenderer<N, E>) forType(diagram.type());
        return renderer.render(diagram);
    }

    /**
     * @return all registered renderers in {@link DiagramType} order
     */
    public static List<DiagramRenderer<?, ?>> all() {
        return Collections.unmodifiableList(new ArrayList<>(RENDERERS.values()));
    }

    @SuppressWarnings("rawtypes")
    private static Map<DiagramType, DiagramRenderer<?, ?>> discover() {
        log.debug("Discovering diagram renderers via ServiceLoader");
        Map<DiagramType, DiagramRenderer<?, ?>> renderers = new EnumMap<>(DiagramType.class);
        ServiceLoader<DiagramRenderer> loader = ServiceLoader.load(DiagramRenderer.class);
        for (DiagramRenderer<?, ?> renderer : loader) {
            DiagramRenderer<?, ?> previous = renderers.putIfAbsent(renderer.getDiagramType(), renderer);
            if (previous != null) {
                log.warn("Ignoring renderer {}: {} is already registered for {}",
                    renderer.getId(), previous.getId(), renderer.getDiagramType());
            } else {
                log.debug("Registered renderer: {} ({})", renderer.getId(), renderer.getDisplayName());
            }
        }
        return Collections.unmodifiableMap(renderers);
    }
}
