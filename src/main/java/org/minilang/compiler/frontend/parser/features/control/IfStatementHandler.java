package org.minilang.compiler.frontend.parser.features.control;

import org.minilang.compiler.frontend.parser.BlockKind;
import org.minilang.compiler.model.TokenType;

/**
 * Handler for the conditional header {@code if ( ... ) then}. Opens a {@link BlockKind#IF} block.
 */
public class IfStatementHandler extends ConditionalBlockHandler {

    public IfStatementHandler() {
        super(BlockKind.IF, TokenType.THEN);
    }
}
