package com.mermaidbuilder.core.graph;

import com.mermaidbuilder.core.model.NodeId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IdAllocator}.
 */
class IdAllocatorTest {

    @Test
    void next_startsAtZeroAndIncrements() {
        IdAllocator allocator = new IdAllocator();

        assertThat(allocator.next()).isEqualTo(new NodeId(0));
        assertThat(allocator.next()).isEqualTo(new NodeId(1));
        assertThat(allocator.next()).isEqualTo(new NodeId(2));
        assertThat(allocator.issuedCount()).isEqualTo(3);
    }

    @Test
    void peek_doesNotConsumeIdentifier() {
        IdAllocator allocator = new IdAllocator();

        assertThat(allocator.peek()).isZero();
        assertThat(allocator.peek()).isZero();
        assertThat(allocator.next().value()).isZero();
        assertThat(allocator.peek()).isEqualTo(1);
    }

    @Test
    void next_onSeparateAllocators_isIndependent() {
        IdAllocator first = new IdAllocator();
        IdAllocator second = new IdAllocator();

        first.next();
        first.next();

        assertThat(second.next()).isEqualTo(new NodeId(0));
    }
}
