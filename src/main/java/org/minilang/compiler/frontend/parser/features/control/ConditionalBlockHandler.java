package org.minilang.compiler.frontend.parser.features.control;

import org.minilang.compiler.frontend.parser.BlockKind;
import org.minilang.compiler.frontend.parser.IStatementHandler;
import org.minilang.compiler.frontend.parser.ParsingContext;
import org.minilang.compiler.model.Token;
import org.minilang.compiler.model.TokenType;

/**
 * Common header handling of {@code while} and {@code if}:
 * {@code <keyword> ( <condition> ) <follow keyword>}.
 * The block is pushed as soon as the keyword is consumed. The condition is only checked
 * for balanced parentheses; its tokens are not validated.
 */
abstract class ConditionalBlockHandler implements IStatementHandler {

    private final BlockKind kind;
    private final TokenType followType;

    ConditionalBlockHandler(BlockKind kind, TokenType followType) {
        this.kind = kind;
        this.followType = followType;
    }

    @Override
    public void parse(ParsingContext context) {
        context.advance(); // consume the keyword
        context.getBlockStack().push(kind);

        if (context.consume(TokenType.LEFT_PAREN, "missing '(' after " + kind.keyword()) == null) {
            return;
        }
        if (!skipCondition(context)) {
            context.getDiagnostics().reportError("unbalanced parentheses in " + kind.keyword() + " condition");
            return;
        }
        context.consume(followType,
                "missing '" + followType.lexeme() + "' after " + kind.keyword() + " condition");
    }

    /**
     * Skips the condition up to and including the parenthesis that closes the one already consumed.
     * @return true if the closing parenthesis was found before the tokens ran out.
     */
    private boolean skipCondition(ParsingContext context) {
        int depth = 1;
        while (!context.isAtEnd()) {
            Token token = context.advance();
            if (token.is(TokenType.LEFT_PAREN)) {
                depth++;
            } else if (token.is(TokenType.RIGHT_PAREN)) {
                depth--;
                if (depth == 0) {
                    return true;
                }
            }
        }
        return false;
    }
}
