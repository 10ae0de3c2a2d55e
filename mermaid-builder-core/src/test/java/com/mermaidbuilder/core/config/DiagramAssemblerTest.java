package com.mermaidbuilder.core.config;

import com.mermaidbuilder.core.graph.Diagram;
import com.mermaidbuilder.core.graph.MissingFieldException;
import com.mermaidbuilder.core.model.ClassEdge;
import com.mermaidbuilder.core.model.ClassNode;
import com.mermaidbuilder.core.model.ClickEvent;
import com.mermaidbuilder.core.model.DiagramType;
import com.mermaidbuilder.core.model.Direction;
import com.mermaidbuilder.core.model.ErEdge;
import com.mermaidbuilder.core.model.FlowchartArrowShape;
import com.mermaidbuilder.core.model.FlowchartEdge;
import com.mermaidbuilder.core.model.FlowchartNode;
import com.mermaidbuilder.core.model.FlowchartNodeShape;
import com.mermaidbuilder.core.model.LayoutEngine;
import com.mermaidbuilder.core.model.LineStyle;
import com.mermaidbuilder.core.model.Look;
import com.mermaidbuilder.core.model.Multiplicity;
import com.mermaidbuilder.core.model.NodeId;
import com.mermaidbuilder.core.model.Theme;
import com.mermaidbuilder.core.renderer.DiagramRenderers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DiagramAssembler}.
 */
class DiagramAssemblerTest {

    @Test
    void assemble_flowchart_buildsNodesAndEdgesInOrder() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: flowchart
            configuration:
              direction: top-to-bottom
              layout: elk
              look: hand-drawn
            nodes:
              - key: start
                label: Start
                shape: circle
              - key: check
                label: In stock?
                shape: diamond
            edges:
              - from: start
                to: check
                arrow: normal
                leftArrow: cross
                lineStyle: thick
                length: 2
            """);

        Diagram<?, ?> diagram = DiagramAssembler.assemble(definition);

        assertThat(diagram.type()).isEqualTo(DiagramType.FLOWCHART);
        assertThat(diagram.configuration().direction()).isEqualTo(Direction.TOP_TO_BOTTOM);
        assertThat(diagram.configuration().layout()).isEqualTo(LayoutEngine.ELK);
        assertThat(diagram.configuration().look()).isEqualTo(Look.HAND_DRAWN);
        assertThat(diagram.nodes()).extracting(node -> ((FlowchartNode) node).shape())
            .containsExactly(FlowchartNodeShape.CIRCLE, FlowchartNodeShape.DIAMOND);

        FlowchartEdge edge = (FlowchartEdge) diagram.edges().get(0);
        assertThat(edge.source().value()).isZero();
        assertThat(edge.destination().value()).isEqualTo(1);
        assertThat(edge.arrowShape()).isEqualTo(FlowchartArrowShape.NORMAL);
        assertThat(edge.leftArrowShape()).isEqualTo(FlowchartArrowShape.CROSS);
        assertThat(edge.lineStyle()).isEqualTo(LineStyle.THICK);
        assertThat(edge.length()).isEqualTo(2);
    }

    @Test
    void assemble_classDiagram_keepsMembersAndMultiplicities() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: class
            configuration:
              theme: redux-dark
              hideEmptyMembersBox: true
            nodes:
              - key: animal
                label: Animal
                annotation: abstract
                members: ["+String name"]
              - key: dog
                label: Dog
            edges:
              - from: animal
                to: dog
                arrow: triangle
                lineStyle: dashed
                leftMultiplicity: one
                rightMultiplicity: one_or_more
                label: parent
            """);

        Diagram<?, ?> diagram = DiagramAssembler.assemble(definition);

        assertThat(diagram.type()).isEqualTo(DiagramType.CLASS_DIAGRAM);
        assertThat(diagram.configuration().theme()).isEqualTo(Theme.REDUX_DARK);
        assertThat(diagram.configuration().hideEmptyMembersBox()).isTrue();
        ClassNode animal = (ClassNode) diagram.nodes().get(0);
        assertThat(animal.annotation()).isEqualTo("abstract");
        assertThat(animal.members()).containsExactly("+String name");
        ClassEdge edge = (ClassEdge) diagram.edges().get(0);
        assertThat(edge.leftMultiplicity()).isEqualTo(Multiplicity.ONE);
        assertThat(edge.rightMultiplicity()).isEqualTo(Multiplicity.ONE_OR_MORE);
        assertThat(edge.label()).isEqualTo("parent");
    }

    @Test
    void assemble_entityRelationship_rendersExpectedText() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: entity_relationship
            nodes:
              - key: customer
                label: CUSTOMER
                attributes:
                  - { type: string, name: name }
              - key: order
                label: ORDER
            edges:
              - from: customer
                to: order
                leftCardinality: exactly_one
                rightCardinality: zero_or_more
                identifying: false
                label: places
            """);

        Diagram<?, ?> diagram = DiagramAssembler.assemble(definition);
        String text = DiagramRenderers.render(diagram);

        assertThat(((ErEdge) diagram.edges().get(0)).identifying()).isFalse();
        assertThat(text).endsWith("""
            erDiagram
            direction LR
            v0["CUSTOMER"] {
                string name
            }
            v1["ORDER"]
            v0 ||..o{ v1 : "places"
            """);
    }

    @Test
    void assemble_unknownNodeKey_throwsException() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: flowchart
            nodes:
              - { key: a, label: A }
            edges:
              - { from: a, to: b, arrow: normal }
            """);

        assertThatThrownBy(() -> DiagramAssembler.assemble(definition))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown node key: b");
    }

    @Test
    void assemble_duplicateNodeKey_throwsException() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: er
            nodes:
              - { key: a, label: A }
              - { key: a, label: B }
            """);

        assertThatThrownBy(() -> DiagramAssembler.assemble(definition))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Duplicate node key: a");
    }

    @Test
    void assemble_missingLabel_propagatesMissingField() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: class
            nodes:
              - { key: a }
            """);

        assertThatThrownBy(() -> DiagramAssembler.assemble(definition))
            .isInstanceOf(MissingFieldException.class)
            .hasMessage("Missing required field: label");
    }

    @Test
    void assemble_edgeWithoutArrow_propagatesMissingRelationship() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: flowchart
            nodes:
              - { key: a, label: A }
            edges:
              - { from: a, to: a }
            """);

        assertThatThrownBy(() -> DiagramAssembler.assemble(definition))
            .isInstanceOf(MissingFieldException.class)
            .hasMessage("Missing required field: relationship");
    }

    @Test
    void assemble_unknownShape_listsAllowedValues() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: flowchart
            nodes:
              - { key: a, label: A, shape: blob }
            """);

        assertThatThrownBy(() -> DiagramAssembler.assemble(definition))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown shape: blob")
            .hasMessageContaining("rectangle");
    }

    @Test
    void assemble_missingType_throwsException() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("nodes: []\n");

        assertThatThrownBy(() -> DiagramAssembler.assemble(definition))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("type is required");
    }

    @ParameterizedTest
    @CsvSource({
        "LR, LEFT_TO_RIGHT",
        "tb, TOP_TO_BOTTOM",
        "TD, TOP_TO_BOTTOM",
        "right_to_left, RIGHT_TO_LEFT",
        "bottom-to-top, BOTTOM_TO_TOP"
    })
    void parseDirection_acceptsShortAndLongNames(String value, Direction expected) {
        assertThat(DiagramAssembler.parseDirection(value)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "flowchart, FLOWCHART",
        "class, CLASS_DIAGRAM",
        "Class-Diagram, CLASS_DIAGRAM",
        "er, ENTITY_RELATIONSHIP",
        "entity_relationship, ENTITY_RELATIONSHIP"
    })
    void parseType_acceptsAliases(String value, DiagramType expected) {
        assertThat(DiagramAssembler.parseType(value)).isEqualTo(expected);
    }

    @Test
    void assemble_flowchartSubgraphAndClick_rendersNestedBlock() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: flowchart
            nodes:
              - key: pay
                label: Pay
                click:
                  url: https://example.com/pay
                  tooltip: Payment docs
                  newTab: true
              - key: ship
                label: Ship
              - key: fulfilment
                label: Fulfilment
                subnodes: [pay, ship]
                direction: TB
            """);

        Diagram<?, ?> diagram = DiagramAssembler.assemble(definition);

        FlowchartNode fulfilment = (FlowchartNode) diagram.nodes().get(2);
        assertThat(fulfilment.subnodes()).extracting(NodeId::value).containsExactly(0, 1);
        assertThat(fulfilment.subgraphDirection()).isEqualTo(Direction.TOP_TO_BOTTOM);
        assertThat(((FlowchartNode) diagram.nodes().get(0)).clickEvent())
            .isEqualTo(new ClickEvent("https://example.com/pay", "Payment docs", true, false));
        assertThat(DiagramRenderers.render(diagram)).isEqualTo("""
            flowchart LR
            subgraph v2 ["Fulfilment"]
                direction TB
                v0@{shape: rect, label: "Pay"}
                click v0 "https://example.com/pay" "Payment docs" _blank
                v1@{shape: rect, label: "Ship"}
            end
            """);
    }

    @Test
    void assemble_subnodeDefinedLater_throwsUnknownKey() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: flowchart
            nodes:
              - { key: group, label: Group, subnodes: [pay] }
              - { key: pay, label: Pay }
            """);

        assertThatThrownBy(() -> DiagramAssembler.assemble(definition))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown node key: pay");
    }

    @Test
    void assemble_clickWithoutUrl_throwsException() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: flowchart
            nodes:
              - { key: docs, label: Docs, click: { tooltip: Open } }
            """);

        assertThatThrownBy(() -> DiagramAssembler.assemble(definition))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Click of node docs requires a url");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "{ type: string }",
        "{ name: email }"
    })
    void assemble_attributeMissingTypeOrName_throwsException(String attribute) throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: er
            nodes:
              - key: customer
                label: CUSTOMER
                attributes:
                  - %s
            """.formatted(attribute));

        assertThatThrownBy(() -> DiagramAssembler.assemble(definition))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Attribute of node customer requires a type and a name");
    }

    @Test
    void assemble_attributeNameWithSpace_throwsException() throws IOException {
        DiagramDefinition definition = DiagramDefinitionLoader.parse("""
            type: er
            nodes:
              - key: customer
                label: CUSTOMER
                attributes:
                  - { type: string, name: first name }
            """);

        assertThatThrownBy(() -> DiagramAssembler.assemble(definition))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("whitespace");
    }
}
