package com.mermaidbuilder.core.model;

/**
 * Finalized, immutable description of a diagram node.
 *
 * <p>Each dialect has its own descriptor record carrying the attributes its syntax can
 * express. Descriptors are only created by node builders once validation has passed.
 */
public interface NodeDescriptor {

    /**
     * @return identifier allocated by the owning graph
     */
    NodeId id();

    /**
     * @return non-empty node label, unescaped
     */
    String label();
}
