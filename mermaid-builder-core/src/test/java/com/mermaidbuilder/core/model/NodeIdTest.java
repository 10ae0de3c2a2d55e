package com.mermaidbuilder.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link NodeId}.
 */
class NodeIdTest {

    @Test
    void mermaidId_prefixesValueWithV() {
        assertThat(new NodeId(0).mermaidId()).isEqualTo("v0");
        assertThat(new NodeId(42).mermaidId()).isEqualTo("v42");
    }

    @Test
    void toString_returnsMermaidId() {
        assertThat(new NodeId(3)).hasToString("v3");
    }

    @Test
    void constructor_withNegativeValue_throwsException() {
        assertThatThrownBy(() -> new NodeId(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("negative");
    }

    @Test
    void equals_comparesValueOnly() {
        assertThat(new NodeId(7)).isEqualTo(new NodeId(7));
        assertThat(new NodeId(7)).isNotEqualTo(new NodeId(8));
    }
}
