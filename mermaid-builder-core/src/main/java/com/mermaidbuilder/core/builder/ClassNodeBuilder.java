package com.mermaidbuilder.core.builder;

import com.mermaidbuilder.core.graph.MissingFieldException;
import com.mermaidbuilder.core.graph.NodeBuilder;
import com.mermaidbuilder.core.model.ClassNode;
import com.mermaidbuilder.core.model.NodeId;
import com.mermaidbuilder.core.model.Visibility;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builder for {@link ClassNode}.
 *
 * <p>Members are free-form lines rendered in the order they were added.
 * {@link #addAttribute(Visibility, String, String)} and
 * {@link #addMethod(Visibility, String, String, String...)} format the usual Mermaid
 * member notation before appending it:
 *
 * <pre>{@code
 * new ClassNodeBuilder()
 *     .setLabel("Account")
 *     .addAttribute(Visibility.PRIVATE, "BigDecimal", "balance")   // -BigDecimal balance
 *     .addMethod(Visibility.PUBLIC, "deposit", "void", "amount")   // +deposit(amount) void
 * }</pre>
 */
public final class ClassNodeBuilder implements NodeBuilder<ClassNode> {

    private String label;
    private String annotation;
    private final List<String> members = new ArrayList<>();

    public ClassNodeBuilder setLabel(String label) {
        this.label = label;
        return this;
    }

    /**
     * Sets the annotation rendered as {@code <<annotation>>}, e.g. {@code interface}.
     *
     * @param annotation annotation text without angle brackets, or {@code null} to clear it
     * @return this builder
     * @throws IllegalArgumentException if the annotation contains a line break, {@code <<} or {@code >>}
     */
    public ClassNodeBuilder setAnnotation(String annotation) {
        this.annotation = annotation == null ? null : ClassNode.requireValidAnnotation(annotation);
        return this;
    }

    /**
     * Appends a free-form member line.
     *
     * @param member member text, e.g. {@code +String owner}
     * @return this builder
     * @throws IllegalArgumentException if the member contains a line break or a closing brace
     */
    public ClassNodeBuilder addMember(String member) {
        members.add(ClassNode.requireValidMember(member));
        return this;
    }

    public ClassNodeBuilder addAttribute(Visibility visibility, String type, String name) {
        Objects.requireNonNull(visibility, "visibility must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        return addMember(visibility.symbol() + type + " " + name);
    }

    /**
     * Appends a method member such as {@code +deposit(amount) void}.
     *
     * @param visibility method visibility
     * @param name method name
     * @param returnType return type, or {@code null} to omit it
     * @param parameters parameter declarations in order
     * @return this builder
     */
    public ClassNodeBuilder addMethod(Visibility visibility, String name, String returnType, String... parameters) {
        Objects.requireNonNull(visibility, "visibility must not be null");
        Objects.requireNonNull(name, "name must not be null");
        StringBuilder member = new StringBuilder()
            .append(visibility.symbol())
            .append(name)
            .append('(')
            .append(String.join(", ", parameters))
            .append(')');
        if (returnType != null) {
            member.append(' ').append(returnType);
        }
        return addMember(member.toString());
    }

    @Override
    public void validate() {
        if (label == null || label.isEmpty()) {
            throw new MissingFieldException("label");
        }
    }

    @Override
    public ClassNode build(NodeId id) {
        validate();
        return new ClassNode(id, label, annotation, members);
    }
}
