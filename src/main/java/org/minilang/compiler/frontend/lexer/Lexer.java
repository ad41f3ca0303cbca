package org.minilang.compiler.frontend.lexer;

import org.minilang.compiler.model.Token;
import org.minilang.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The lexer (or scanner) for the mini-language. It turns source text into a flat list of
 * {@link Token}s. Scanning is total: every character ends up in exactly one token or is
 * skipped as whitespace, and malformed input is carried forward as {@link TokenType#ERROR} tokens.
 */
public class Lexer {

    private static final String DELIMITERS = ";:,()+-*/<>=";

    private final String source;
    private int start = 0;
    private int current = 0;

    /**
     * Constructs a new Lexer.
     * @param source The source text to be tokenized.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Scans the entire source and returns the token list. Empty or whitespace-only
     * source produces an empty list.
     * @return The list of tokens, in source order.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        while (!isAtEnd()) {
            if (isWhitespace(peek())) {
                current++;
                continue;
            }
            start = current;
            tokens.add(scanToken().toToken());
        }
        return tokens;
    }

    /**
     * Scans exactly one token starting at the current position.
     * @return The scan outcome.
     */
    ScanResult scanToken() {
        char c = peek();
        if (isAlpha(c)) return word();
        if (isDigit(c)) return number();
        return operatorOrDelimiter();
    }

    private ScanResult word() {
        while (!isAtEnd() && !isWordBoundary(peek())) current++;
        String text = source.substring(start, current);

        Optional<TokenType> keyword = TokenType.keyword(text);
        if (keyword.isPresent()) {
            return scanned(keyword.get());
        }
        for (int i = 0; i < text.length(); i++) {
            if (!isAlphaNumeric(text.charAt(i))) {
                return new ScanResult.LexicalError(text);
            }
        }
        return scanned(TokenType.IDENTIFIER);
    }

    private ScanResult number() {
        while (!isAtEnd() && isDigit(peek())) current++;
        if (!isAtEnd() && !isWordBoundary(peek())) {
            // digit-led word such as "9i" is a malformed identifier, not a number
            while (!isAtEnd() && !isWordBoundary(peek())) current++;
            return new ScanResult.LexicalError(source.substring(start, current));
        }
        return scanned(TokenType.NUMBER);
    }

    private ScanResult operatorOrDelimiter() {
        char c = advance();
        switch (c) {
            case '+': return scanned(TokenType.PLUS);
            case '-': return scanned(TokenType.MINUS);
            case '*': return scanned(TokenType.STAR);
            case '/': return scanned(TokenType.SLASH);
            case ';': return scanned(TokenType.SEMICOLON);
            case '(': return scanned(TokenType.LEFT_PAREN);
            case ')': return scanned(TokenType.RIGHT_PAREN);
            case ',': return scanned(TokenType.COMMA);
            case ':': return scanned(match('=') ? TokenType.ASSIGN : TokenType.COLON);
            case '<':
                if (match('>')) return scanned(TokenType.NOT_EQUAL);
                if (match('=')) return scanned(TokenType.LESS_EQUAL);
                return scanned(TokenType.LESS);
            case '>': return scanned(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '=':
                if (match('=')) return scanned(TokenType.EQUAL_EQUAL);
                return new ScanResult.LexicalError("=");
            default:
                // one error per code point, so a surrogate pair stays whole
                current = start + Character.charCount(source.codePointAt(start));
                return new ScanResult.LexicalError(source.substring(start, current));
        }
    }

    private ScanResult scanned(TokenType type) {
        return new ScanResult.Scanned(new Token(type, source.substring(start, current)));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return source.charAt(current);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isWordBoundary(char c) {
        return isWhitespace(c) || DELIMITERS.indexOf(c) >= 0;
    }

    static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\u000B' || c == '\f' || c == '\r';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
