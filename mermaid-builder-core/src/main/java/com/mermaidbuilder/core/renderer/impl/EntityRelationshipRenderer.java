package com.mermaidbuilder.core.renderer.impl;

import com.mermaidbuilder.core.model.Cardinality;
import com.mermaidbuilder.core.model.DiagramConfiguration;
import com.mermaidbuilder.core.model.DiagramType;
import com.mermaidbuilder.core.model.ErAttribute;
import com.mermaidbuilder.core.model.ErEdge;
import com.mermaidbuilder.core.model.ErNode;
import com.mermaidbuilder.core.renderer.base.AbstractMermaidRenderer;
import com.mermaidbuilder.core.util.MermaidText;

/**
 * Renders entity-relationship diagrams.
 *
 * <p>Entities without attributes are written on one line; entities with attributes open
 * a block with one {@code type name} line per attribute. Relationships always carry a
 * quoted label, empty when none was set, because Mermaid requires one.
 */
public class EntityRelationshipRenderer extends AbstractMermaidRenderer<ErNode, ErEdge> {

    private static final String RENDERER_ID = "er";
    private static final String RENDERER_DISPLAY_NAME = "Mermaid Entity-Relationship Renderer";
    private static final String HEADER_KEYWORD = "erDiagram";
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
        return DiagramType.ENTITY_RELATIONSHIP;
    }

    @Override
    protected boolean includeFrontMatter(DiagramConfiguration config) {
        return true;
    }

    @Override
    protected void appendHeader(StringBuilder sb, DiagramConfiguration config) {
        appendLine(sb, HEADER_KEYWORD);
        appendLine(sb, DIRECTION_KEYWORD + directionToken(config.direction()));
    }

    @Override
    protected void appendNode(StringBuilder sb, ErNode node) {
        String entity = node.id().mermaidId() + "[" + MermaidText.quote(node.label()) + "]";
        if (node.attributes().isEmpty()) {
            appendLine(sb, entity);
            return;
        }
        appendLine(sb, entity + " {");
        for (ErAttribute attribute : node.attributes()) {
            appendIndentedLine(sb, attribute.type() + " " + attribute.name());
        }
        appendLine(sb, "}");
    }

    @Override
    protected void appendEdge(StringBuilder sb, ErEdge edge) {
        appendLine(sb, edge.source().mermaidId()
            + " " + relationshipToken(edge.leftCardinality(), edge.identifying(), edge.rightCardinality())
            + " " + edge.destination().mermaidId()
            + " : " + MermaidText.quote(edge.label()));
    }

    /**
     * Builds the complete relationship token, e.g. <code>||--o&#123;</code> or <code>&#125;|..|&#123;</code>.
     *
     * @param left cardinality at the source end
     * @param identifying solid line when true, dotted otherwise
     * @param right cardinality at the destination end
     * @return relationship token
     */
    public static String relationshipToken(Cardinality left, boolean identifying, Cardinality right) {
        return leftCardinalityToken(left) + (identifying ? "--" : "..") + rightCardinalityToken(right);
    }

    public static String leftCardinalityToken(Cardinality cardinality) {
        return switch (cardinality) {
            case EXACTLY_ONE -> "||";
            case ZERO_OR_ONE -> "|o";
            case ONE_OR_MORE -> "}|";
            case ZERO_OR_MORE -> "}o";
        };
    }

    public static String rightCardinalityToken(Cardinality cardinality) {
        return switch (cardinality) {
            case EXACTLY_ONE -> "||";
            case ZERO_OR_ONE -> "o|";
            case ONE_OR_MORE -> "|{";
            case ZERO_OR_MORE -> "o{";
        };
    }
}
