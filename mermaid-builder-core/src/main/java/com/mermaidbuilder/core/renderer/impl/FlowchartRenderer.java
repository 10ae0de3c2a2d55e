package com.mermaidbuilder.core.renderer.impl;

import com.mermaidbuilder.core.graph.Diagram;
import com.mermaidbuilder.core.model.ClickEvent;
import com.mermaidbuilder.core.model.DiagramConfiguration;
import com.mermaidbuilder.core.model.DiagramType;
import com.mermaidbuilder.core.model.FlowchartArrowShape;
import com.mermaidbuilder.core.model.FlowchartEdge;
import com.mermaidbuilder.core.model.FlowchartNode;
import com.mermaidbuilder.core.model.FlowchartNodeShape;
import com.mermaidbuilder.core.model.LineStyle;
import com.mermaidbuilder.core.model.NodeId;
import com.mermaidbuilder.core.renderer.base.AbstractMermaidRenderer;
import com.mermaidbuilder.core.util.MermaidText;

import java.util.HashSet;
import java.util.Set;

/**
 * Renders flowcharts using the Mermaid expanded node syntax.
 *
 * <pre>
 * flowchart LR
 * v0@{shape: rect, label: "Start"}
 * v1@{shape: rect, label: "End"}
 * v0 ---&gt; v1
 * </pre>
 *
 * <p>Front matter is only written when the configuration differs from the defaults, so a
 * default flowchart starts directly with its header line.
 *
 * <p>Subgraphs are written where they appear at the top level, with their subnodes nested
 * inside and indented one level per depth. A subnode is never written at the top level:
 *
 * <pre>
 * subgraph v1 ["Fulfilment"]
 *     direction TB
 *     v0@{shape: rect, label: "Pay"}
 *     click v0 href "https://example.com/pay" "Open"
 * end
 * </pre>
 */
public class FlowchartRenderer extends AbstractMermaidRenderer<FlowchartNode, FlowchartEdge> {

    private static final String RENDERER_ID = "flowchart";
    private static final String RENDERER_DISPLAY_NAME = "Mermaid Flowchart Renderer";
    private static final String HEADER_KEYWORD = "flowchart ";

    @Override
    public String getId() {
        return RENDERER_ID;
    }

    @Override
    public String getDisplayName() {
        return RENDERER_DISPLAY_NAME;
    }

    @Override
    public DiagramType getDiagramType() {
        return DiagramType.FLOWCHART;
    }

    @Override
    protected boolean includeFrontMatter(DiagramConfiguration config) {
        return !config.isDefault();
    }

    @Override
    protected void appendHeader(StringBuilder sb, DiagramConfiguration config) {
        appendLine(sb, HEADER_KEYWORD + directionToken(config.direction()));
    }

    @Override
    protected void appendNodes(StringBuilder sb, Diagram<FlowchartNode, FlowchartEdge> diagram) {
        Set<NodeId> nested = new HashSet<>();
        for (FlowchartNode node : diagram.nodes()) {
            nested.addAll(node.subnodes());
        }
        for (FlowchartNode node : diagram.nodes()) {
            if (nested.contains(node.id())) {
                continue;
            }
            if (node.isSubgraph()) {
                appendSubgraph(sb, diagram, node, "");
            } else {
                appendNode(sb, node);
            }
        }
    }

    @Override
    protected void appendNode(StringBuilder sb, FlowchartNode node) {
        appendLeaf(sb, node, "");
    }

    private void appendSubgraph(StringBuilder sb, Diagram<FlowchartNode, FlowchartEdge> diagram,
                                FlowchartNode subgraph, String indent) {
        appendLine(sb, indent + "subgraph " + subgraph.id().mermaidId() + " [" + MermaidText.quote(subgraph.label()) + "]");
        if (subgraph.subgraphDirection() != null) {
            appendLine(sb, indent + INDENT + "direction " + directionToken(subgraph.subgraphDirection()));
        }
        for (NodeId id : subgraph.subnodes()) {
            FlowchartNode child = diagram.node(id)
                .orElseThrow(() -> new IllegalStateException("Subnode " + id + " is not part of the diagram"));
            if (child.isSubgraph()) {
                appendSubgraph(sb, diagram, child, indent + INDENT);
            } else {
                appendLeaf(sb, child, indent + INDENT);
            }
        }
        appendLine(sb, indent + "end");
    }

    private static void appendLeaf(StringBuilder sb, FlowchartNode node, String indent) {
        appendLine(sb, indent + nodeLine(node));
        if (node.clickEvent() != null) {
            appendLine(sb, indent + clickLine(node.id(), node.clickEvent()));
        }
    }

    private static String nodeLine(FlowchartNode node) {
        return node.id().mermaidId()
            + "@{shape: " + shapeToken(node.shape())
            + ", label: " + MermaidText.quote(node.label()) + "}";
    }

    /**
     * Builds the click statement of a node, e.g. {@code click v0 href "https://example.com" _blank}.
     *
     * @param id clicked node
     * @param event navigation target and options
     * @return click statement without indentation
     */
    public static String clickLine(NodeId id, ClickEvent event) {
        StringBuilder line = new StringBuilder("click ").append(id.mermaidId()).append(' ');
        if (event.anchor()) {
            line.append("href ");
        }
        line.append('"').append(event.url()).append('"');
        if (event.tooltip() != null) {
            line.append(' ').append(MermaidText.quote(event.tooltip()));
        }
        if (event.newTab()) {
            line.append(" _blank");
        }
        return line.toString();
    }

    @Override
    protected void appendEdge(StringBuilder sb, FlowchartEdge edge) {
        StringBuilder line = new StringBuilder()
            .append(edge.source().mermaidId())
            .append(' ')
            .append(linkToken(edge.leftArrowShape(), edge.lineStyle(), edge.length(), edge.arrowShape()));
        if (edge.label() != null) {
            line.append('|').append(MermaidText.quote(edge.label())).append('|');
        }
        line.append(' ').append(edge.destination().mermaidId());
        appendLine(sb, line.toString());
    }

    /**
     * Builds the complete link token, e.g. {@code <-.->} or {@code ===o}.
     *
     * @param left head at the source end
     * @param lineStyle stroke
     * @param length extra link length, at least 1
     * @param right head at the destination end
     * @return link token
     */
    public static String linkToken(FlowchartArrowShape left, LineStyle lineStyle, int length, FlowchartArrowShape right) {
        return leftHeadToken(left) + segmentToken(lineStyle, length) + rightHeadToken(right);
    }

    public static String segmentToken(LineStyle lineStyle, int length) {
        return switch (lineStyle) {
            case SOLID -> "-".repeat(2 + length);
            case THICK -> "=".repeat(2 + length);
            case DASHED -> "-" + ".".repeat(length) + "-";
        };
    }

    public static String rightHeadToken(FlowchartArrowShape shape) {
        return switch (shape) {
            case NORMAL -> ">";
            case CIRCLE -> "o";
            case CROSS -> "x";
            case NONE -> "";
        };
    }

    public static String leftHeadToken(FlowchartArrowShape shape) {
        return switch (shape) {
            case NORMAL -> "<";
            case CIRCLE -> "o";
            case CROSS -> "x";
            case NONE -> "";
        };
    }

    public static String shapeToken(FlowchartNodeShape shape) {
        return switch (shape) {
            case RECTANGLE -> "rect";
            case ROUNDED -> "rounded";
            case STADIUM -> "stadium";
            case SUBPROCESS -> "subproc";
            case DIVIDED_RECTANGLE -> "div-rect";
            case LINED_RECTANGLE -> "lin-rect";
            case STACKED_RECTANGLE -> "processes";
            case TAGGED_RECTANGLE -> "tag-rect";
            case FRAMED_RECTANGLE -> "fr-rect";
            case NOTCHED_RECTANGLE -> "notch-rect";
            case SLOPED_RECTANGLE -> "sl-rect";
            case BOW_TIE_RECTANGLE -> "bow-rect";
            case WINDOW_PANE -> "win-pane";
            case FORK -> "fork";
            case DELAY -> "delay";
            case CYLINDER -> "cyl";
            case HORIZONTAL_CYLINDER -> "das";
            case LINED_CYLINDER -> "lin-cyl";
            case CIRCLE -> "circle";
            case DOUBLE_CIRCLE -> "dbl-circ";
            case SMALL_CIRCLE -> "sm-circ";
            case FRAMED_CIRCLE -> "framed-circle";
            case FILLED_CIRCLE -> "f-circ";
            case CROSSED_CIRCLE -> "cross-circ";
            case DIAMOND -> "diamond";
            case HEXAGON -> "hex";
            case ODD -> "odd";
            case LEAN_RIGHT -> "lean-r";
            case LEAN_LEFT -> "lean-l";
            case TRAPEZOID -> "trap-b";
            case INVERTED_TRAPEZOID -> "trap-t";
            case CURVED_TRAPEZOID -> "curv-trap";
            case TRIANGLE -> "tri";
            case FLIPPED_TRIANGLE -> "flip-tri";
            case HOURGLASS -> "hourglass";
            case NOTCHED_PENTAGON -> "notch-pent";
            case FLAG -> "flag";
            case LIGHTNING_BOLT -> "bolt";
            case DOCUMENT -> "doc";
            case LINED_DOCUMENT -> "lin-doc";
            case STACKED_DOCUMENT -> "docs";
            case TAGGED_DOCUMENT -> "tag-doc";
            case LEFT_BRACE -> "comment";
            case RIGHT_BRACE -> "brace-r";
            case BRACES -> "braces";
            case TEXT -> "text";
        };
    }
}
