package com.mermaidbuilder.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Declarative description of a diagram, read from YAML.
 *
 * <p>Nodes are referenced from edges by their {@code key}; the keys never appear in the
 * rendered output. Enumerated values are written as case-insensitive constant names, with
 * {@code -} accepted in place of {@code _}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * type: entity_relationship
 * configuration:
 *   title: Orders
 *   theme: forest
 *
 * nodes:
 *   - key: customer
 *     label: CUSTOMER
 *     attributes:
 *       - { type: string, name: name }
 *   - key: order
 *     label: ORDER
 *
 * edges:
 *   - from: customer
 *     to: order
 *     leftCardinality: exactly_one
 *     rightCardinality: zero_or_more
 *     label: places
 * }</pre>
 *
 * @param type dialect: {@code flowchart}, {@code class} or {@code entity_relationship}
 * @param configuration optional document settings
 * @param nodes node definitions in render order
 * @param edges edge definitions in render order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiagramDefinition(
    @JsonProperty("type") String type,
    @JsonProperty("configuration") ConfigurationDefinition configuration,
    @JsonProperty("nodes") List<NodeDefinition> nodes,
    @JsonProperty("edges") List<EdgeDefinition> edges
) {
    /**
     * Compact constructor normalizing absent lists to empty ones.
     */
    public DiagramDefinition {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * Document settings. Absent values fall back to the Mermaid defaults.
     *
     * @param title diagram title
     * @param direction direction name or {@code LR}/{@code TB}/{@code RL}/{@code BT}
     * @param layout layout engine name
     * @param theme theme name
     * @param look look name
     * @param hideEmptyMembersBox class diagrams only
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConfigurationDefinition(
        @JsonProperty("title") String title,
        @JsonProperty("direction") String direction,
        @JsonProperty("layout") String layout,
        @JsonProperty("theme") String theme,
        @JsonProperty("look") String look,
        @JsonProperty("hideEmptyMembersBox") Boolean hideEmptyMembersBox
    ) {}

    /**
     * Node of any dialect. Fields that do not apply to the dialect are ignored.
     *
     * @param key unique key referenced by edges
     * @param label node label
     * @param shape flowchart shape
     * @param annotation class annotation
     * @param members class member lines
     * @param attributes entity attributes
     * @param subnodes flowchart keys of earlier nodes grouped into this subgraph
     * @param direction flowchart subgraph direction
     * @param click flowchart click navigation
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NodeDefinition(
        @JsonProperty("key") String key,
        @JsonProperty("label") String label,
        @JsonProperty("shape") String shape,
        @JsonProperty("annotation") String annotation,
        @JsonProperty("members") List<String> members,
        @JsonProperty("attributes") List<AttributeDefinition> attributes,
        @JsonProperty("subnodes") List<String> subnodes,
        @JsonProperty("direction") String direction,
        @JsonProperty("click") ClickDefinition click
    ) {
        /**
         * Compact constructor normalizing absent lists to empty ones.
         */
        public NodeDefinition {
            members = members == null ? List.of() : List.copyOf(members);
            attributes = attributes == null ? List.of() : List.copyOf(attributes);
            subnodes = subnodes == null ? List.of() : List.copyOf(subnodes);
        }
    }

    /**
     * Flowchart click navigation.
     *
     * @param url link target
     * @param tooltip optional tooltip
     * @param newTab open in a new tab
     * @param anchor use an {@code href} anchor link
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClickDefinition(
        @JsonProperty("url") String url,
        @JsonProperty("tooltip") String tooltip,
        @JsonProperty("newTab") Boolean newTab,
        @JsonProperty("anchor") Boolean anchor
    ) {}

    /**
     * Entity attribute.
     *
     * @param type attribute type
     * @param name attribute name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AttributeDefinition(
        @JsonProperty("type") String type,
        @JsonProperty("name") String name
    ) {}

    /**
     * Edge of any dialect. Fields that do not apply to the dialect are ignored.
     *
     * @param from source node key
     * @param to destination node key
     * @param arrow flowchart or class head at the destination end
     * @param leftArrow flowchart or class head at the source end
     * @param lineStyle line style
     * @param length flowchart link length
     * @param leftMultiplicity class multiplicity at the source end
     * @param rightMultiplicity class multiplicity at the destination end
     * @param leftCardinality entity cardinality at the source end
     * @param rightCardinality entity cardinality at the destination end
     * @param identifying entity relationship kind
     * @param label edge label
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EdgeDefinition(
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("arrow") String arrow,
        @JsonProperty("leftArrow") String leftArrow,
        @JsonProperty("lineStyle") String lineStyle,
        @JsonProperty("length") Integer length,
        @JsonProperty("leftMultiplicity") String leftMultiplicity,
        @JsonProperty("rightMultiplicity") String rightMultiplicity,
        @JsonProperty("leftCardinality") String leftCardinality,
        @JsonProperty("rightCardinality") String rightCardinality,
        @JsonProperty("identifying") Boolean identifying,
        @JsonProperty("label") String label
    ) {}
}
