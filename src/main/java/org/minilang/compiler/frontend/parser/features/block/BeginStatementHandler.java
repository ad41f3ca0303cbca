package org.minilang.compiler.frontend.parser.features.block;

import org.minilang.compiler.frontend.parser.BlockKind;
import org.minilang.compiler.frontend.parser.IStatementHandler;
import org.minilang.compiler.frontend.parser.ParsingContext;

/**
 * Handler for a nested {@code begin}. Opens a {@link BlockKind#BEGIN} block.
 */
public class BeginStatementHandler implements IStatementHandler {

    @Override
    public void parse(ParsingContext context) {
        context.advance();
        context.getBlockStack().push(BlockKind.BEGIN);
    }
}
