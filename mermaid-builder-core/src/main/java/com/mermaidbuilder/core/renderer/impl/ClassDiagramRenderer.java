package com.mermaidbuilder.core.renderer.impl;

import com.mermaidbuilder.core.model.ClassArrowShape;
import com.mermaidbuilder.core.model.ClassEdge;
import com.mermaidbuilder.core.model.ClassNode;
import com.mermaidbuilder.core.model.DiagramConfiguration;
import com.mermaidbuilder.core.model.DiagramType;
import com.mermaidbuilder.core.model.LineStyle;
import com.mermaidbuilder.core.model.Multiplicity;
import com.mermaidbuilder.core.renderer.base.AbstractMermaidRenderer;
import com.mermaidbuilder.core.util.MermaidText;

/**
 * Renders class diagrams.
 *
 * <p>The front matter is always written because it carries the
 * {@code class.hideEmptyMembersBox} setting. Each class is written as a block, even
 * without members, so Mermaid shows its member compartment consistently.
 *
 * <p>Member lines and annotations are written verbatim: member notation relies on
 * {@code #} and {@code ~}, which label escaping would destroy.
 */
public class ClassDiagramRenderer extends AbstractMermaidRenderer<ClassNode, ClassEdge> {

    private static final String RENDERER_ID = "class";
    private static final String RENDERER_DISPLAY_NAME = "Mermaid Class Diagram Renderer";
    private static final String HEADER_KEYWORD = "classDiagram";
    private static final String DIRECTION_KEYWORD = "direction ";

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
        return DiagramType.CLASS_DIAGRAM;
    }

    @Override
    protected boolean includeFrontMatter(DiagramConfiguration config) {
        return true;
    }

    @Override
    protected void appendFrontMatterExtras(StringBuilder sb, DiagramConfiguration config) {
        appendLine(sb, "  class:");
        appendLine(sb, "    hideEmptyMembersBox: " + config.hideEmptyMembersBox());
    }

    @Override
    protected void appendHeader(StringBuilder sb, DiagramConfiguration config) {
        appendLine(sb, HEADER_KEYWORD);
        appendLine(sb, DIRECTION_KEYWORD + directionToken(config.direction()));
    }

    @Override
    protected void appendNode(StringBuilder sb, ClassNode node) {
        appendLine(sb, "class " + node.id().mermaidId() + "[" + MermaidText.quote(node.label()) + "] {");
        if (node.annotation() != null) {
            appendIndentedLine(sb, "<<" + node.annotation() + ">>");
        }
        for (String member : node.members()) {
            appendIndentedLine(sb, member);
        }
        appendLine(sb, "}");
    }

    @Override
    protected void appendEdge(StringBuilder sb, ClassEdge edge) {
        StringBuilder line = new StringBuilder()
            .append(edge.source().mermaidId())
            .append(' ');
        if (edge.leftMultiplicity() != null) {
            line.append('"').append(multiplicityToken(edge.leftMultiplicity())).append("\" ");
        }
        line.append(relationToken(edge.leftArrowShape(), edge.lineStyle(), edge.arrowShape()));
        if (edge.rightMultiplicity() != null) {
            line.append(" \"").append(multiplicityToken(edge.rightMultiplicity())).append('"');
        }
        line.append(' ').append(edge.destination().mermaidId());
        if (edge.label() != null) {
            line.append(" : ").append(MermaidText.escapeLabel(edge.label()));
        }
        appendLine(sb, line.toString());
    }

    /**
     * Builds the complete relation token, e.g. {@code --|>} or {@code *..o}.
     *
     * @param left head at the source end
     * @param lineStyle {@link LineStyle#SOLID} or {@link LineStyle#DASHED}
     * @param right head at the destination end
     * @return relation token
     */
    public static String relationToken(ClassArrowShape left, LineStyle lineStyle, ClassArrowShape right) {
        return leftHeadToken(left) + segmentToken(lineStyle) + rightHeadToken(right);
    }

    /**
     * @param lineStyle {@link LineStyle#SOLID} or {@link LineStyle#DASHED}
     * @return segment token
     * @throws IllegalArgumentException for {@link LineStyle#THICK}
     */
    public static String segmentToken(LineStyle lineStyle) {
        return switch (lineStyle) {
            case SOLID -> "--";
            case DASHED -> "..";
            case THICK -> throw new IllegalArgumentException("Class diagrams have no thick line style");
        };
    }

    public static String rightHeadToken(ClassArrowShape shape) {
        return switch (shape) {
            case TRIANGLE -> "|>";
            case NORMAL -> ">";
            case STAR -> "*";
            case CIRCLE -> "o";
            case NONE -> "";
        };
    }

    public static String leftHeadToken(ClassArrowShape shape) {
        return switch (shape) {
            case TRIANGLE -> "<|";
            case NORMAL -> "<";
            case STAR -> "*";
            case CIRCLE -> "o";
            case NONE -> "";
        };
    }

    public static String multiplicityToken(Multiplicity multiplicity) {
        return switch (multiplicity) {
            case ONE -> "1";
            case ZERO_OR_ONE -> "0..1";
            case ONE_OR_MORE -> "1..*";
            case MANY -> "*";
            case N -> "n";
            case ZERO_TO_N -> "0..n";
            case ONE_TO_N -> "1..n";
        };
    }
}
