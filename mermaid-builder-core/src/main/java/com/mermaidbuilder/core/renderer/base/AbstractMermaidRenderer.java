package com.mermaidbuilder.core.renderer.base;

import com.mermaidbuilder.core.graph.Diagram;
import com.mermaidbuilder.core.model.DiagramConfiguration;
import com.mermaidbuilder.core.model.Direction;
import com.mermaidbuilder.core.model.EdgeDescriptor;
import com.mermaidbuilder.core.model.LayoutEngine;
import com.mermaidbuilder.core.model.Look;
import com.mermaidbuilder.core.model.NodeDescriptor;
import com.mermaidbuilder.core.model.Theme;
import com.mermaidbuilder.core.renderer.DiagramRenderer;
import com.mermaidbuilder.core.util.MermaidText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Abstract base class for Mermaid renderers providing the document skeleton.
 *
 * <p>This class fixes the order every dialect is written in:
 * <ol>
 *   <li>optional YAML front matter ({@link #includeFrontMatter(DiagramConfiguration)})</li>
 *   <li>header lines ({@link #appendHeader(StringBuilder, DiagramConfiguration)})</li>
 *   <li>one block per node, in insertion order ({@link #appendNodes(StringBuilder, Diagram)})</li>
 *   <li>one line per edge, in insertion order</li>
 * </ol>
 *
 * <p>It also owns the token tables shared by all dialects (direction, layout engine,
 * theme, look) and the line helpers that guarantee every line ends with {@code \n}.
 *
 * @param <N> node descriptor type of the dialect
 * @param <E> edge descriptor type of the dialect
 * @see DiagramRenderer
 */
public abstract class AbstractMermaidRenderer<N extends NodeDescriptor, E extends EdgeDescriptor>
        implements DiagramRenderer<N, E> {

    /** Indentation of lines nested inside a node block. */
    protected static final String INDENT = "    ";

    private static final String NEWLINE = "\n";
    private static final String FRONT_MATTER_DELIMITER = "---";
    private static final String FILE_EXTENSION = "mmd";

    /**
     * Logger instance for this renderer.
     * Automatically initialized with the concrete renderer class name.
     */
    protected final Logger log;

    protected AbstractMermaidRenderer() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public final String render(Diagram<N, E> diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        if (diagram.type() != getDiagramType()) {
            throw new IllegalArgumentException(
                getDisplayName() + " cannot render diagram of type " + diagram.type());
        }

        DiagramConfiguration config = diagram.configuration();
        StringBuilder sb = new StringBuilder();

        if (includeFrontMatter(config)) {
            appendFrontMatter(sb, config);
        }
        appendHeader(sb, config);
        appendNodes(sb, diagram);
        for (E edge : diagram.edges()) {
            appendEdge(sb, edge);
        }

        log.debug("Rendered {} diagram: {} nodes, {} edges",
            getId(), diagram.nodes().size(), diagram.edges().size());
        return sb.toString();
    }

    // ==================== Dialect Hooks ====================

    /**
     * Decides whether the YAML front matter block is written.
     *
     * @param config diagram configuration
     * @return true to write the block
     */
    protected abstract boolean includeFrontMatter(DiagramConfiguration config);

    /**
     * Appends dialect-specific entries to the {@code config:} map of the front matter.
     * Does nothing by default.
     *
     * @param sb the string builder
     * @param config diagram configuration
     */
    protected void appendFrontMatterExtras(StringBuilder sb, DiagramConfiguration config) {
    }

    protected abstract void appendHeader(StringBuilder sb, DiagramConfiguration config);

    /**
     * Appends the node section. Writes every node in insertion order by default; dialects
     * with nested nodes override this to control grouping.
     *
     * @param sb the string builder
     * @param diagram diagram being rendered
     */
    protected void appendNodes(StringBuilder sb, Diagram<N, E> diagram) {
        for (N node : diagram.nodes()) {
            appendNode(sb, node);
        }
    }

    protected abstract void appendNode(StringBuilder sb, N node);

    protected abstract void appendEdge(StringBuilder sb, E edge);

    // ==================== Front Matter ====================

    private void appendFrontMatter(StringBuilder sb, DiagramConfiguration config) {
        appendLine(sb, FRONT_MATTER_DELIMITER);
        appendLine(sb, "config:");
        appendLine(sb, "  layout: " + layoutToken(config.layout()));
        appendLine(sb, "  theme: " + themeToken(config.theme()));
        appendLine(sb, "  look: " + lookToken(config.look()));
        appendFrontMatterExtras(sb, config);
        if (config.title() != null) {
            appendLine(sb, "title: " + MermaidText.yamlScalar(config.title()));
        }
        appendLine(sb, FRONT_MATTER_DELIMITER);
    }

    // ==================== Line Helpers ====================

    /**
     * Appends a line terminated by {@code \n}.
     *
     * @param sb the string builder
     * @param line line content without terminator
     */
    protected static void appendLine(StringBuilder sb, String line) {
        sb.append(line).append(NEWLINE);
    }

    /**
     * Appends a line nested one level inside a node block.
     *
     * @param sb the string builder
     * @param line line content without indentation or terminator
     */
    protected static void appendIndentedLine(StringBuilder sb, String line) {
        sb.append(INDENT).append(line).append(NEWLINE);
    }

    // ==================== Shared Token Tables ====================

    public static String directionToken(Direction direction) {
        return switch (direction) {
            case LEFT_TO_RIGHT -> "LR";
            case TOP_TO_BOTTOM -> "TB";
            case RIGHT_TO_LEFT -> "RL";
            case BOTTOM_TO_TOP -> "BT";
        };
    }

    public static String layoutToken(LayoutEngine layout) {
        return switch (layout) {
            case DAGRE -> "dagre";
            case ELK -> "elk";
        };
    }

    public static String themeToken(Theme theme) {
        return switch (theme) {
            case MERMAID_CHART -> "mc";
            case NEO -> "neo";
            case NEO_DARK -> "neo-dark";
            case DEFAULT -> "default";
            case FOREST -> "forest";
            case BASE -> "base";
            case DARK -> "dark";
            case NEUTRAL -> "neutral";
            case REDUX -> "redux";
            case REDUX_DARK -> "redux-dark";
        };
    }

    public static String lookToken(Look look) {
        return switch (look) {
            case CLASSIC -> "classic";
            case NEO -> "neo";
            case HAND_DRAWN -> "handDrawn";
        };
    }
}
