package com.mermaidbuilder.core.config;

import com.mermaidbuilder.core.builder.ClassEdgeBuilder;
import com.mermaidbuilder.core.builder.ClassNodeBuilder;
import com.mermaidbuilder.core.builder.ErEdgeBuilder;
import com.mermaidbuilder.core.builder.ErNodeBuilder;
import com.mermaidbuilder.core.builder.FlowchartEdgeBuilder;
import com.mermaidbuilder.core.builder.FlowchartNodeBuilder;
import com.mermaidbuilder.core.config.DiagramDefinition.AttributeDefinition;
import com.mermaidbuilder.core.config.DiagramDefinition.ClickDefinition;
import com.mermaidbuilder.core.config.DiagramDefinition.ConfigurationDefinition;
import com.mermaidbuilder.core.config.DiagramDefinition.EdgeDefinition;
import com.mermaidbuilder.core.config.DiagramDefinition.NodeDefinition;
import com.mermaidbuilder.core.graph.Diagram;
import com.mermaidbuilder.core.graph.GraphBuilder;
import com.mermaidbuilder.core.graph.NodeBuilder;
import com.mermaidbuilder.core.model.Cardinality;
import com.mermaidbuilder.core.model.ClassArrowShape;
import com.mermaidbuilder.core.model.ClassEdge;
import com.mermaidbuilder.core.model.ClassNode;
import com.mermaidbuilder.core.model.ClickEvent;
import com.mermaidbuilder.core.model.DiagramConfiguration;
import com.mermaidbuilder.core.model.DiagramType;
import com.mermaidbuilder.core.model.Direction;
import com.mermaidbuilder.core.model.EdgeDescriptor;
import com.mermaidbuilder.core.model.ErEdge;
import com.mermaidbuilder.core.model.ErNode;
import com.mermaidbuilder.core.model.FlowchartArrowShape;
import com.mermaidbuilder.core.model.FlowchartEdge;
import com.mermaidbuilder.core.model.FlowchartNode;
import com.mermaidbuilder.core.model.FlowchartNodeShape;
import com.mermaidbuilder.core.model.LayoutEngine;
import com.mermaidbuilder.core.model.LineStyle;
import com.mermaidbuilder.core.model.Look;
import com.mermaidbuilder.core.model.Multiplicity;
import com.mermaidbuilder.core.model.NodeDescriptor;
import com.mermaidbuilder.core.model.NodeId;
import com.mermaidbuilder.core.model.Theme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns a {@link DiagramDefinition} into a {@link Diagram} by driving the regular
 * builders, so a definition is subject to exactly the same validation as code.
 *
 * <p>Definition-level mistakes (unknown dialect, unknown or duplicate node key, unknown
 * enum name) raise {@link IllegalArgumentException}. Missing required fields surface as the
 * builders' {@link com.mermaidbuilder.core.graph.MissingFieldException}.
 */
public final class DiagramAssembler {

    private static final Logger log = LoggerFactory.getLogger(DiagramAssembler.class);

    private DiagramAssembler() {
        // Utility class
    }

    /**
     * Assembles a diagram from its definition.
     *
     * @param definition parsed definition
     * @return finalized diagram of the definition's dialect
     * @throws IllegalArgumentException if the definition references unknown keys or values
     */
    public static Diagram<?, ?> assemble(DiagramDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");

        DiagramType type = parseType(definition.type());
        DiagramConfiguration configuration = toConfiguration(definition.configuration());
        log.debug("Assembling {} diagram from definition", type);

        return switch (type) {
            case FLOWCHART -> assembleFlowchart(definition, configuration);
            case CLASS_DIAGRAM -> assembleClassDiagram(definition, configuration);
            case ENTITY_RELATIONSHIP -> assembleEntityRelationship(definition, configuration);
        };
    }

    // ==================== Dialects ====================

    private static Diagram<FlowchartNode, FlowchartEdge> assembleFlowchart(
            DiagramDefinition definition, DiagramConfiguration configuration) {
        GraphBuilder<FlowchartNode, FlowchartEdge> graph = GraphBuilder.flowchart().configure(configuration);
        Map<String, NodeId> keys = new HashMap<>();

        for (NodeDefinition node : definition.nodes()) {
            FlowchartNodeBuilder builder = new FlowchartNodeBuilder().setLabel(node.label());
            if (node.shape() != null) {
                builder.setShape(parseEnum(FlowchartNodeShape.class, node.shape(), "shape"));
            }
            for (String subnode : node.subnodes()) {
                builder.addSubnode(resolve(keys, subnode));
            }
            if (node.direction() != null) {
                builder.setDirection(parseDirection(node.direction()));
            }
            if (node.click() != null) {
                builder.setClickEvent(toClickEvent(node.key(), node.click()));
            }
            addNode(graph, keys, node.key(), builder);
        }

        for (EdgeDefinition edge : definition.edges()) {
            FlowchartEdgeBuilder builder = new FlowchartEdgeBuilder()
                .setSource(resolve(keys, edge.from()))
                .setDestination(resolve(keys, edge.to()))
                .setLabel(edge.label());
            if (edge.arrow() != null) {
                builder.setArrowShape(parseEnum(FlowchartArrowShape.class, edge.arrow(), "arrow"));
            }
            if (edge.leftArrow() != null) {
                builder.setLeftArrowShape(parseEnum(FlowchartArrowShape.class, edge.leftArrow(), "leftArrow"));
            }
            if (edge.lineStyle() != null) {
                builder.setLineStyle(parseEnum(LineStyle.class, edge.lineStyle(), "lineStyle"));
            }
            if (edge.length() != null) {
                builder.setLength(edge.length());
            }
            graph.addEdge(builder);
        }

        return graph.build();
    }

    private static Diagram<ClassNode, ClassEdge> assembleClassDiagram(
            DiagramDefinition definition, DiagramConfiguration configuration) {
        GraphBuilder<ClassNode, ClassEdge> graph = GraphBuilder.classDiagram().configure(configuration);
        Map<String, NodeId> keys = new HashMap<>();

        for (NodeDefinition node : definition.nodes()) {
            ClassNodeBuilder builder = new ClassNodeBuilder()
                .setLabel(node.label())
                .setAnnotation(node.annotation());
            node.members().forEach(builder::addMember);
            addNode(graph, keys, node.key(), builder);
        }

        for (EdgeDefinition edge : definition.edges()) {
            ClassEdgeBuilder builder = new ClassEdgeBuilder()
                .setSource(resolve(keys, edge.from()))
                .setDestination(resolve(keys, edge.to()))
                .setLabel(edge.label());
            if (edge.arrow() != null) {
                builder.setArrowShape(parseEnum(ClassArrowShape.class, edge.arrow(), "arrow"));
            }
            if (edge.leftArrow() != null) {
                builder.setLeftArrowShape(parseEnum(ClassArrowShape.class, edge.leftArrow(), "leftArrow"));
            }
            if (edge.lineStyle() != null) {
                builder.setLineStyle(parseEnum(LineStyle.class, edge.lineStyle(), "lineStyle"));
            }
            if (edge.leftMultiplicity() != null) {
                builder.setLeftMultiplicity(parseEnum(Multiplicity.class, edge.leftMultiplicity(), "leftMultiplicity"));
            }
            if (edge.rightMultiplicity() != null) {
                builder.setRightMultiplicity(parseEnum(Multiplicity.class, edge.rightMultiplicity(), "rightMultiplicity"));
            }
            graph.addEdge(builder);
        }

        return graph.build();
    }

    private static Diagram<ErNode, ErEdge> assembleEntityRelationship(
            DiagramDefinition definition, DiagramConfiguration configuration) {
        GraphBuilder<ErNode, ErEdge> graph = GraphBuilder.entityRelationship().configure(configuration);
        Map<String, NodeId> keys = new HashMap<>();

        for (NodeDefinition node : definition.nodes()) {
            ErNodeBuilder builder = new ErNodeBuilder().setLabel(node.label());
            for (AttributeDefinition attribute : node.attributes()) {
                if (attribute.type() == null || attribute.name() == null) {
                    throw new IllegalArgumentException(
                        "Attribute of node " + node.key() + " requires a type and a name");
                }
                builder.addAttribute(attribute.type(), attribute.name());
            }
            addNode(graph, keys, node.key(), builder);
        }

        for (EdgeDefinition edge : definition.edges()) {
            ErEdgeBuilder builder = new ErEdgeBuilder()
                .setSource(resolve(keys, edge.from()))
                .setDestination(resolve(keys, edge.to()))
                .setLabel(edge.label());
            if (edge.leftCardinality() != null) {
                builder.setLeftCardinality(parseEnum(Cardinality.class, edge.leftCardinality(), "leftCardinality"));
            }
            if (edge.rightCardinality() != null) {
                builder.setRightCardinality(parseEnum(Cardinality.class, edge.rightCardinality(), "rightCardinality"));
            }
            if (edge.identifying() != null) {
                builder.setIdentifying(edge.identifying());
            }
            graph.addEdge(builder);
        }

        return graph.build();
    }

    private static ClickEvent toClickEvent(String key, ClickDefinition click) {
        if (click.url() == null) {
            throw new IllegalArgumentException("Click of node " + key + " requires a url");
        }
        return ClickEvent.navigate(click.url())
            .withTooltip(click.tooltip())
            .withNewTab(Boolean.TRUE.equals(click.newTab()))
            .withAnchor(Boolean.TRUE.equals(click.anchor()));
    }

    // ==================== Keys ====================

    private static <N extends NodeDescriptor, E extends EdgeDescriptor> void addNode(
            GraphBuilder<N, E> graph, Map<String, NodeId> keys, String key, NodeBuilder<? extends N> builder) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Node key is required");
        }
        if (keys.containsKey(key)) {
            throw new IllegalArgumentException("Duplicate node key: " + key);
        }
        keys.put(key, graph.addNode(builder));
    }

    /**
     * Resolves an edge endpoint. An absent key resolves to {@code null} so the edge
     * builder reports the missing endpoint itself.
     */
    private static NodeId resolve(Map<String, NodeId> keys, String key) {
        if (key == null) {
            return null;
        }
        NodeId id = keys.get(key);
        if (id == null) {
            throw new IllegalArgumentException("Unknown node key: " + key);
        }
        return id;
    }

    // ==================== Values ====================

    static DiagramType parseType(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Diagram type is required");
        }
        return switch (normalize(value)) {
            case "FLOWCHART" -> DiagramType.FLOWCHART;
            case "CLASS", "CLASS_DIAGRAM" -> DiagramType.CLASS_DIAGRAM;
            case "ER", "ENTITY_RELATIONSHIP" -> DiagramType.ENTITY_RELATIONSHIP;
            default -> throw new IllegalArgumentException(
                "Unknown diagram type: " + value + ". Allowed values: flowchart, class, entity_relationship");
        };
    }

    static DiagramConfiguration toConfiguration(ConfigurationDefinition definition) {
        if (definition == null) {
            return DiagramConfiguration.defaults();
        }
        return new DiagramConfiguration(
            definition.title(),
            definition.direction() == null ? null : parseDirection(definition.direction()),
            definition.layout() == null ? null : parseEnum(LayoutEngine.class, definition.layout(), "layout"),
            definition.theme() == null ? null : parseEnum(Theme.class, definition.theme(), "theme"),
            definition.look() == null ? null : parseEnum(Look.class, definition.look(), "look"),
            Boolean.TRUE.equals(definition.hideEmptyMembersBox())
        );
    }

    static Direction parseDirection(String value) {
        return switch (normalize(value)) {
            case "LR" -> Direction.LEFT_TO_RIGHT;
            case "TB", "TD" -> Direction.TOP_TO_BOTTOM;
            case "RL" -> Direction.RIGHT_TO_LEFT;
            case "BT" -> Direction.BOTTOM_TO_TOP;
            default -> parseEnum(Direction.class, value, "direction");
        };
    }

    /**
     * Parses an enum constant case-insensitively, accepting {@code -} for {@code _}.
     *
     * @throws IllegalArgumentException naming the field, the value and the allowed constants
     */
    static <T extends Enum<T>> T parseEnum(Class<T> type, String value, String field) {
        String normalized = normalize(value);
        for (T constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }
        String allowed = Arrays.stream(type.getEnumConstants())
            .map(constant -> constant.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
            "Unknown " + field + ": " + value + ". Allowed values: " + allowed);
    }

    private static String normalize(String value) {
        return value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    }
}
