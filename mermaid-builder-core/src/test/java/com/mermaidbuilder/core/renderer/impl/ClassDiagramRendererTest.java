package com.mermaidbuilder.core.renderer.impl;

import com.mermaidbuilder.core.builder.ClassEdgeBuilder;
import com.mermaidbuilder.core.builder.ClassNodeBuilder;
import com.mermaidbuilder.core.graph.Diagram;
import com.mermaidbuilder.core.graph.GraphBuilder;
import com.mermaidbuilder.core.model.ClassArrowShape;
import com.mermaidbuilder.core.model.ClassEdge;
import com.mermaidbuilder.core.model.ClassNode;
import com.mermaidbuilder.core.model.DiagramConfiguration;
import com.mermaidbuilder.core.model.Direction;
import com.mermaidbuilder.core.model.LayoutEngine;
import com.mermaidbuilder.core.model.LineStyle;
import com.mermaidbuilder.core.model.Look;
import com.mermaidbuilder.core.model.Multiplicity;
import com.mermaidbuilder.core.model.NodeId;
import com.mermaidbuilder.core.model.Theme;
import com.mermaidbuilder.core.model.Visibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ClassDiagramRenderer}.
 */
class ClassDiagramRendererTest {

    private ClassDiagramRenderer renderer;
    private GraphBuilder<ClassNode, ClassEdge> graph;

    @BeforeEach
    void setUp() {
        renderer = new ClassDiagramRenderer();
        graph = GraphBuilder.classDiagram();
    }

    @Test
    void render_inheritance_matchesExpectedText() {
        NodeId animal = graph.addNode(new ClassNodeBuilder().setLabel("Animal"));
        NodeId dog = graph.addNode(new ClassNodeBuilder().setLabel("Dog"));
        graph.addEdge(new ClassEdgeBuilder()
            .setSource(animal)
            .setDestination(dog)
            .setArrowShape(ClassArrowShape.TRIANGLE));

        String text = renderer.render(graph.build());

        assertThat(text).isEqualTo("""
            ---
            config:
              layout: dagre
              theme: default
              look: classic
              class:
                hideEmptyMembersBox: false
            ---
            classDiagram
            direction LR
            class v0["Animal"] {
            }
            class v1["Dog"] {
            }
            v0 --|> v1
            """);
    }

    @Test
    void render_withConfiguration_writesAllSettings() {
        graph.configure(new DiagramConfiguration("Zoo", Direction.TOP_TO_BOTTOM, LayoutEngine.ELK,
            Theme.FOREST, Look.NEO, true));

        String text = renderer.render(graph.build());

        assertThat(text).isEqualTo("""
            ---
            config:
              layout: elk
              theme: forest
              look: neo
              class:
                hideEmptyMembersBox: true
            title: Zoo
            ---
            classDiagram
            direction TB
            """);
    }

    @Test
    void render_nodeWithAnnotationAndMembers_writesIndentedBlock() {
        graph.addNode(new ClassNodeBuilder()
            .setLabel("Shape")
            .setAnnotation("interface")
            .addAttribute(Visibility.PROTECTED, "String", "name")
            .addMethod(Visibility.PUBLIC, "area", "double"));

        String text = renderer.render(graph.build());

        assertThat(text).endsWith("""
            class v0["Shape"] {
                <<interface>>
                #String name
                +area() double
            }
            """);
    }

    @Test
    void render_edgeWithMultiplicitiesAndLabel_writesFullRelation() {
        NodeId owner = graph.addNode(new ClassNodeBuilder().setLabel("Owner"));
        NodeId pet = graph.addNode(new ClassNodeBuilder().setLabel("Pet"));
        graph.addEdge(new ClassEdgeBuilder()
            .setSource(owner)
            .setDestination(pet)
            .setArrowShape(ClassArrowShape.NORMAL)
            .setLeftMultiplicity(Multiplicity.ONE)
            .setRightMultiplicity(Multiplicity.MANY)
            .setLabel("owns"));
        graph.addEdge(new ClassEdgeBuilder()
            .setSource(pet)
            .setDestination(owner)
            .setArrowShape(ClassArrowShape.CIRCLE)
            .setLeftArrowShape(ClassArrowShape.STAR)
            .setLineStyle(LineStyle.DASHED));

        String text = renderer.render(graph.build());

        assertThat(text).contains("v0 \"1\" --> \"*\" v1 : owns\n");
        assertThat(text).endsWith("v1 *..o v0\n");
    }

    @Test
    void render_escapesClassLabel() {
        graph.addNode(new ClassNodeBuilder().setLabel("List\"T\""));

        assertThat(renderer.render(graph.build())).contains("class v0[\"List#quot;T#quot;\"] {\n");
    }

    @Test
    void relationToken_withDefaults_matchesMermaidRelations() {
        assertThat(ClassDiagramRenderer.relationToken(ClassArrowShape.NONE, LineStyle.SOLID, ClassArrowShape.TRIANGLE))
            .isEqualTo("--|>");
        assertThat(ClassDiagramRenderer.relationToken(ClassArrowShape.NONE, LineStyle.SOLID, ClassArrowShape.NORMAL))
            .isEqualTo("-->");
        assertThat(ClassDiagramRenderer.relationToken(ClassArrowShape.NONE, LineStyle.SOLID, ClassArrowShape.STAR))
            .isEqualTo("--*");
        assertThat(ClassDiagramRenderer.relationToken(ClassArrowShape.NONE, LineStyle.SOLID, ClassArrowShape.CIRCLE))
            .isEqualTo("--o");
        assertThat(ClassDiagramRenderer.relationToken(ClassArrowShape.NONE, LineStyle.SOLID, ClassArrowShape.NONE))
            .isEqualTo("--");
        assertThat(ClassDiagramRenderer.relationToken(ClassArrowShape.TRIANGLE, LineStyle.DASHED, ClassArrowShape.NONE))
            .isEqualTo("<|..");
    }

    @Test
    void tokens_areDistinctPerConstant() {
        assertThat(Arrays.stream(ClassArrowShape.values()).map(ClassDiagramRenderer::rightHeadToken))
            .doesNotHaveDuplicates();
        assertThat(Arrays.stream(ClassArrowShape.values()).map(ClassDiagramRenderer::leftHeadToken))
            .doesNotHaveDuplicates();
        assertThat(Arrays.stream(Multiplicity.values()).map(ClassDiagramRenderer::multiplicityToken))
            .doesNotHaveDuplicates();
    }

    @Test
    void segmentToken_thick_throwsException() {
        assertThatThrownBy(() -> ClassDiagramRenderer.segmentToken(LineStyle.THICK))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void render_isDeterministic() {
        NodeId account = graph.addNode(new ClassNodeBuilder()
            .setLabel("Account")
            .setAnnotation("entity")
            .addAttribute(Visibility.PRIVATE, "BigDecimal", "balance"));
        NodeId owner = graph.addNode(new ClassNodeBuilder().setLabel("Owner"));
        graph.addEdge(new ClassEdgeBuilder().setSource(owner).setDestination(account)
            .setArrowShape(ClassArrowShape.NORMAL).setLabel("owns"));
        Diagram<ClassNode, ClassEdge> diagram = graph.build();

        String first = renderer.render(diagram);

        assertThat(renderer.render(diagram)).isEqualTo(first);
        assertThat(new ClassDiagramRenderer().render(diagram)).isEqualTo(first);
    }

    @Test
    void render_membersStayInsideClassBlock() {
        graph.addNode(new ClassNodeBuilder().setLabel("A").addMember("+int x"));
        ClassNodeBuilder hostile = new ClassNodeBuilder().setLabel("B");

        assertThatThrownBy(() -> hostile.addMember("+int y\n}\nclass Injected"))
            .isInstanceOf(IllegalArgumentException.class);
        graph.addNode(hostile);

        String text = renderer.render(graph.build());

        assertThat(text).doesNotContain("Injected");
        assertThat(text).endsWith("""
            class v0["A"] {
                +int x
            }
            class v1["B"] {
            }
            """);
    }
}
