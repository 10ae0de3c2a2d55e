package com.mermaidbuilder.core.graph;

import com.mermaidbuilder.core.model.NodeId;

/**
 * Issues dense, monotonically increasing node identifiers starting at {@code 0}.
 *
 * <p>Every {@link GraphBuilder} owns its own allocator, so identifiers are local to one
 * diagram. Not thread-safe.
 */
public final class IdAllocator {

    private int next;

    /**
     * Returns the next unused identifier and advances the allocator.
     *
     * @return freshly issued identifier
     */
    public NodeId next() {
        return new NodeId(next++);
    }

    /**
     * Returns the value the next call to {@link #next()} will issue, without consuming it.
     *
     * @return next identifier value
     */
    public int peek() {
        return next;
    }

    /**
     * @return number of identifiers issued so far
     */
    public int issuedCount() {
        return next;
    }
}
