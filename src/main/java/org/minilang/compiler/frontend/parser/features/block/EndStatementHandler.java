package org.minilang.compiler.frontend.parser.features.block;

import org.minilang.compiler.frontend.parser.BlockKind;
import org.minilang.compiler.frontend.parser.IStatementHandler;
import org.minilang.compiler.frontend.parser.ParsingContext;
import org.minilang.compiler.model.TokenType;

import java.util.Optional;

/**
 * Handler for {@code end}. Closes the innermost open block.
 * <p>
 * A nested {@code end} must be followed by {@code ;}. The {@code end} that closes the
 * last open block terminates the program: it is left unconsumed so that the caller can
 * verify the program terminator.
 */
public class EndStatementHandler implements IStatementHandler {

    @Override
    public void parse(ParsingContext context) {
        Optional<BlockKind> closed = context.getBlockStack().pop();
        if (closed.isEmpty()) {
            context.getDiagnostics().reportError("unmatched end");
            return;
        }
        if (context.getBlockStack().isEmpty()) {
            return;
        }
        context.advance();
        context.consume(TokenType.SEMICOLON, closed.get().keyword() + "'s end missing ';'");
    }
}
