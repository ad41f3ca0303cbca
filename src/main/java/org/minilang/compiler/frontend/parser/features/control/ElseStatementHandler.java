package org.minilang.compiler.frontend.parser.features.control;

import org.minilang.compiler.frontend.parser.BlockKind;
import org.minilang.compiler.frontend.parser.IStatementHandler;
import org.minilang.compiler.frontend.parser.ParsingContext;

/**
 * Handler for {@code else}. Only valid directly inside an {@code if} block; the {@code if}
 * stays open and is closed by the next {@code end}.
 */
public class ElseStatementHandler implements IStatementHandler {

    @Override
    public void parse(ParsingContext context) {
        boolean insideIf = context.getBlockStack().peek()
                .map(kind -> kind == BlockKind.IF)
                .orElse(false);
        if (!insideIf) {
            context.getDiagnostics().reportError("'else' not matched to 'if'");
            return;
        }
        context.advance();
    }
}
