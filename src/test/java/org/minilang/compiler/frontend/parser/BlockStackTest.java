package org.minilang.compiler.frontend.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class BlockStackTest {

    @Test
    void popsInReverseOrder() {
        BlockStack stack = new BlockStack();
        stack.push(BlockKind.BEGIN);
        stack.push(BlockKind.WHILE);
        stack.push(BlockKind.IF);

        assertThat(stack.depth()).isEqualTo(3);
        assertThat(stack.pop()).contains(BlockKind.IF);
        assertThat(stack.pop()).contains(BlockKind.WHILE);
        assertThat(stack.peek()).contains(BlockKind.BEGIN);
        assertThat(stack.pop()).contains(BlockKind.BEGIN);
        assertThat(stack.isEmpty()).isTrue();
    }

    @Test
    void emptyStackYieldsEmptyOptionals() {
        BlockStack stack = new BlockStack();

        assertThat(stack.peek()).isEmpty();
        assertThat(stack.pop()).isEmpty();
        assertThat(stack.depth()).isZero();
    }
}
