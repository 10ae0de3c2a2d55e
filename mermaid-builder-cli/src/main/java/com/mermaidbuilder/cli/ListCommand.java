package com.mermaidbuilder.cli;

import com.mermaidbuilder.core.model.Cardinality;
import com.mermaidbuilder.core.model.ClassArrowShape;
import com.mermaidbuilder.core.model.FlowchartArrowShape;
import com.mermaidbuilder.core.model.FlowchartNodeShape;
import com.mermaidbuilder.core.model.LineStyle;
import com.mermaidbuilder.core.renderer.DiagramRenderer;
import com.mermaidbuilder.core.renderer.DiagramRenderers;
import com.mermaidbuilder.core.renderer.impl.ClassDiagramRenderer;
import com.mermaidbuilder.core.renderer.impl.EntityRelationshipRenderer;
import com.mermaidbuilder.core.renderer.impl.FlowchartRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available dialects and their token tables.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Renderers discovered via SPI
 * mermaid-builder list dialects
 *
 * # Flowchart node shapes and their Mermaid tokens
 * mermaid-builder list shapes
 *
 * # Flowchart and class diagram arrow heads
 * mermaid-builder list arrows
 *
 * # Entity-relationship cardinalities
 * mermaid-builder list cardinalities
 * }</pre>
 */
@Command(
    name = "list",
    description = "List dialects, flowchart shapes, arrows, or cardinalities",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: dialects, shapes, arrows, or cardinalities"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "dialects", "dialect" -> listDialects();
            case "shapes", "shape" -> listShapes();
            case "arrows", "arrow" -> listArrows();
            case "cardinalities", "cardinality" -> listCardinalities();
            default -> {
                log.error("Unknown type: {}. Use: dialects, shapes, arrows, or cardinalities", type);
                yield 1;
            }
        };
    }

    private int listDialects() {
        System.out.println("Available Dialects:");
        System.out.println();

        List<DiagramRenderer<?, ?>> renderers = DiagramRenderers.all();
        for (DiagramRenderer<?, ?> renderer : renderers) {
            System.out.printf("  • %s (ID: %s)%n", renderer.getDisplayName(), renderer.getId());
            System.out.printf("    Diagram Type: %s%n", renderer.getDiagramType());
            System.out.printf("    File Extension: .%s%n", renderer.getFileExtension());
            System.out.println();
        }

        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }

        return 0;
    }

    private int listShapes() {
        System.out.println("Flowchart Node Shapes:");
        System.out.println();

        for (FlowchartNodeShape shape : FlowchartNodeShape.values()) {
            System.out.printf("  %-20s %s%n", shape, FlowchartRenderer.shapeToken(shape));
        }

        return 0;
    }

    private int listArrows() {
        System.out.println("Flowchart Arrows:");
        System.out.println();
        for (FlowchartArrowShape shape : FlowchartArrowShape.values()) {
            System.out.printf("  %-20s %s%n", shape,
                FlowchartRenderer.linkToken(FlowchartArrowShape.NONE, LineStyle.SOLID, 1, shape));
        }

        System.out.println();
        System.out.println("Class Diagram Arrows:");
        System.out.println();
        for (ClassArrowShape shape : ClassArrowShape.values()) {
            System.out.printf("  %-20s %s%n", shape,
                ClassDiagramRenderer.relationToken(ClassArrowShape.NONE, LineStyle.SOLID, shape));
        }

        return 0;
    }

    private int listCardinalities() {
        System.out.println("Entity-Relationship Cardinalities:");
        System.out.println();

        for (Cardinality cardinality : Cardinality.values()) {
            System.out.printf("  %-20s %s / %s%n", cardinality,
                EntityRelationshipRenderer.leftCardinalityToken(cardinality),
                EntityRelationshipRenderer.rightCardinalityToken(cardinality));
        }

        return 0;
    }
}
