package com.mermaidbuilder.core.builder;

import com.mermaidbuilder.core.graph.EdgeBuilder;
import com.mermaidbuilder.core.graph.MissingFieldException;
import com.mermaidbuilder.core.model.Cardinality;
import com.mermaidbuilder.core.model.ErEdge;
import com.mermaidbuilder.core.model.NodeId;

/**
 * Builder for {@link ErEdge}.
 *
 * <p>Both cardinalities form the relationship and must be set, either one by one or with
 * the symmetric helpers:
 *
 * <pre>{@code
 * graph.addEdge(ErEdgeBuilder.oneOrMore(customer, order).setLabel("places"));
 * }</pre>
 *
 * <p>Relationships are identifying (solid line) unless {@link #setIdentifying(boolean)}
 * says otherwise.
 */
public final class ErEdgeBuilder implements EdgeBuilder<ErEdge> {

    private NodeId source;
    private NodeId destination;
    private Cardinality leftCardinality;
    private Cardinality rightCardinality;
    private boolean identifying = true;
    private String label;

    public static ErEdgeBuilder exactlyOne(NodeId source, NodeId destination) {
        return symmetric(source, destination, Cardinality.EXACTLY_ONE);
    }

    public static ErEdgeBuilder zeroOrOne(NodeId source, NodeId destination) {
        return symmetric(source, destination, Cardinality.ZERO_OR_ONE);
    }

    public static ErEdgeBuilder oneOrMore(NodeId source, NodeId destination) {
        return symmetric(source, destination, Cardinality.ONE_OR_MORE);
    }

    public static ErEdgeBuilder zeroOrMore(NodeId source, NodeId destination) {
        return symmetric(source, destination, Cardinality.ZERO_OR_MORE);
    }

    private static ErEdgeBuilder symmetric(NodeId source, NodeId destination, Cardinality cardinality) {
        return new ErEdgeBuilder()
            .setSource(source)
            .setDestination(destination)
            .setLeftCardinality(cardinality)
            .setRightCardinality(cardinality);
    }

    public ErEdgeBuilder setSource(NodeId source) {
        this.source = source;
        return this;
    }

    public ErEdgeBuilder setDestination(NodeId destination) {
        this.destination = destination;
        return this;
    }

    public ErEdgeBuilder setLeftCardinality(Cardinality leftCardinality) {
        this.leftCardinality = leftCardinality;
        return this;
    }

    public ErEdgeBuilder setRightCardinality(Cardinality rightCardinality) {
        this.rightCardinality = rightCardinality;
        return this;
    }

    public ErEdgeBuilder setIdentifying(boolean identifying) {
        this.identifying = identifying;
        return this;
    }

    public ErEdgeBuilder setLabel(String label) {
        this.label = label;
        return this;
    }

    @Override
    public ErEdge build() {
        if (source == null) {
            throw new MissingFieldException("source");
        }
        if (destination == null) {
            throw new MissingFieldException("destination");
        }
        if (leftCardinality == null || rightCardinality == null) {
            throw new MissingFieldException("relationship");
        }
        return new ErEdge(source, destination, leftCardinality, rightCardinality, identifying, label);
    }
}
