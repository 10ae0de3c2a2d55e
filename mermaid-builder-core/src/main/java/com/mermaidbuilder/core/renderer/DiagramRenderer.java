package com.mermaidbuilder.core.renderer;

import com.mermaidbuilder.core.graph.Diagram;
import com.mermaidbuilder.core.model.DiagramType;
import com.mermaidbuilder.core.model.EdgeDescriptor;
import com.mermaidbuilder.core.model.NodeDescriptor;

/**
 * Serializes a finalized {@link Diagram} of one dialect to Mermaid source text.
 *
 * <p>Renderers are pure functions of the diagram: the same diagram value always yields
 * byte-identical output, and rendering never fails because every structural invariant was
 * enforced while the diagram was built. Labels are escaped here, not at construction.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FlowchartRenderer extends AbstractMermaidRenderer<FlowchartNode, FlowchartEdge> {
 *     @Override
 *     public String getId() {
 *         return "flowchart";
 *     }
 *
 *     @Override
 *     public DiagramType getDiagramType() {
 *         return DiagramType.FLOWCHART;
 *     }
 *
 *     @Override
 *     public String render(Diagram<FlowchartNode, FlowchartEdge> diagram) {
 *         StringBuilder sb = new StringBuilder();
 *         appendLine(sb, "flowchart " + directionToken(diagram.configuration().direction()));
 *         diagram.nodes().forEach(node -> appendNode(sb, node));
 *         diagram.edges().forEach(edge -> appendEdge(sb, edge));
 *         return sb.toString();
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.mermaidbuilder.core.renderer.DiagramRenderer}
 *
 * @param <N> node descriptor type of the dialect
 * @param <E> edge descriptor type of the dialect
 * @see DiagramRenderers
 */
public interface DiagramRenderer<N extends NodeDescriptor, E extends EdgeDescriptor> {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Lowercase, e.g. "flowchart", "class", "er".
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for rendered diagrams, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Returns the dialect this renderer serializes.
     *
     * @return diagram type
     */
    DiagramType getDiagramType();

    /**
     * Renders the diagram to Mermaid source.
     *
     * <p>Every line, including the last one, ends with {@code \n}.
     *
     * @param diagram finalized diagram of this renderer's dialect
     * @return Mermaid source text
     * @throws IllegalArgumentException if the diagram is of another dialect
     */
    String render(Diagram<N, E> diagram);
}
