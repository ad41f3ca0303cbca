package org.minilang.compiler.frontend.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * LIFO stack of the blocks opened in the realization section and not yet closed by {@code end}.
 */
public class BlockStack {

    private final Deque<BlockKind> blocks = new ArrayDeque<>();

    public void push(BlockKind kind) {
        blocks.push(kind);
    }

    /**
     * Removes the innermost open block.
     * @return The removed block, or empty if no block is open.
     */
    public Optional<BlockKind> pop() {
        return Optional.ofNullable(blocks.poll());
    }

    /**
     * @return The innermost open block, or empty if no block is open.
     */
    public Optional<BlockKind> peek() {
        return Optional.ofNullable(blocks.peek());
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public int depth() {
        return blocks.size();
    }
}
