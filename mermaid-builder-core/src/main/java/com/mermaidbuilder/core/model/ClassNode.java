package com.mermaidbuilder.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Node of a class diagram.
 *
 * <p>Members and the annotation are written verbatim inside the class block, one line each,
 * so they may not contain line breaks or the tokens that close their enclosing syntax.
 *
 * @param id allocated node identifier
 * @param label class name shown in the diagram
 * @param annotation optional annotation such as {@code interface}, {@code null} when unset
 * @param members member lines in insertion order
 */
public record ClassNode(
    NodeId id,
    String label,
    String annotation,
    List<String> members
) implements NodeDescriptor {
    /**
     * Compact constructor with validation.
     */
    public ClassNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        if (annotation != null) {
            requireValidAnnotation(annotation);
        }
        members = members == null ? List.of() : List.copyOf(members);
        members.forEach(ClassNode::requireValidMember);
    }

    /**
     * Checks that a member fits on one line inside the class block.
     *
     * @param member member text
     * @return the member, unchanged
     * @throws IllegalArgumentException if the member contains a line break or a closing brace
     */
    public static String requireValidMember(String member) {
        Objects.requireNonNull(member, "member must not be null");
        if (containsLineBreak(member) || member.indexOf('}') >= 0) {
            throw new IllegalArgumentException(
                "Member must be a single line without '}': " + member.strip());
        }
        return member;
    }

    /**
     * Checks that an annotation stays inside its {@code <<...>>} markers.
     *
     * @param annotation annotation text without angle brackets
     * @return the annotation, unchanged
     * @throws IllegalArgumentException if the annotation contains a line break, {@code <<} or {@code >>}
     */
    public static String requireValidAnnotation(String annotation) {
        Objects.requireNonNull(annotation, "annotation must not be null");
        if (containsLineBreak(annotation) || annotation.contains("<<") || annotation.contains(">>")) {
            throw new IllegalArgumentException(
                "Annotation must be a single line without '<<' or '>>': " + annotation.strip());
        }
        return annotation;
    }

    private static boolean containsLineBreak(String text) {
        return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
    }
}
