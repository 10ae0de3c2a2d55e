package com.mermaidbuilder.core.builder;

import com.mermaidbuilder.core.graph.MissingFieldException;
import com.mermaidbuilder.core.graph.NodeBuilder;
import com.mermaidbuilder.core.model.ErAttribute;
import com.mermaidbuilder.core.model.ErNode;
import com.mermaidbuilder.core.model.NodeId;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for {@link ErNode}.
 */
public final class ErNodeBuilder implements NodeBuilder<ErNode> {

    private String label;
    private final List<ErAttribute> attributes = new ArrayList<>();

    public ErNodeBuilder setLabel(String label) {
        this.label = label;
        return this;
    }

    public ErNodeBuilder addAttribute(String type, String name) {
        attributes.add(new ErAttribute(type, name));
        return this;
    }

    @Override
    public void validate() {
        if (label == null || label.isEmpty()) {
            throw new MissingFieldException("label");
        }
    }

    @Override
    public ErNode build(NodeId id) {
        validate();
        return new ErNode(id, label, attributes);
    }
}
