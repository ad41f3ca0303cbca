package org.minilang.compiler.frontend.parser.features.control;

import org.minilang.compiler.frontend.parser.BlockKind;
import org.minilang.compiler.model.TokenType;

/**
 * Handler for the loop header {@code while ( ... ) do}. Opens a {@link BlockKind#WHILE} block.
 */
public class WhileStatementHandler extends ConditionalBlockHandler {

    public WhileStatementHandler() {
        super(BlockKind.WHILE, TokenType.DO);
    }
}
