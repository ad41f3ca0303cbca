package org.minilang.compiler.frontend.lexer;

import org.minilang.compiler.model.Token;
import org.minilang.compiler.model.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests the tokenization rules of the {@link Lexer}.
 */
@Tag("unit")
class LexerTest {

    private static List<Token> scan(String source) {
        return new Lexer(source).scanTokens();
    }

    @Test
    void tokenizesCompactProgram() {
        List<Token> tokens = scan("Var i,j:integer;Begin i:=0;End");

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.VAR, "Var"),
                tuple(TokenType.IDENTIFIER, "i"),
                tuple(TokenType.COMMA, ","),
                tuple(TokenType.IDENTIFIER, "j"),
                tuple(TokenType.COLON, ":"),
                tuple(TokenType.INTEGER, "integer"),
                tuple(TokenType.SEMICOLON, ";"),
                tuple(TokenType.BEGIN, "Begin"),
                tuple(TokenType.IDENTIFIER, "i"),
                tuple(TokenType.ASSIGN, ":="),
                tuple(TokenType.NUMBER, "0"),
                tuple(TokenType.SEMICOLON, ";"),
                tuple(TokenType.END, "End"));
    }

    @Test
    void keywordsMatchCaseInsensitivelyAndKeepOriginalText() {
        List<Token> tokens = scan("WHILE While wHiLe LongInt BOOL");

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.WHILE, TokenType.WHILE, TokenType.WHILE, TokenType.LONGINT, TokenType.BOOL);
        assertThat(tokens).extracting(Token::text)
                .containsExactly("WHILE", "While", "wHiLe", "LongInt", "BOOL");
    }

    @Test
    void allKeywordsAreRecognized() {
        List<Token> tokens = scan("var integer longint bool if then else while do for begin end and or");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.VAR, TokenType.INTEGER, TokenType.LONGINT, TokenType.BOOL, TokenType.IF,
                TokenType.THEN, TokenType.ELSE, TokenType.WHILE, TokenType.DO, TokenType.FOR,
                TokenType.BEGIN, TokenType.END, TokenType.AND, TokenType.OR);
    }

    @Test
    void identifiersAreCaseSensitiveAndMayContainDigits() {
        List<Token> tokens = scan("J1 j1 abc123");

        assertThat(tokens).extracting(Token::type).containsOnly(TokenType.IDENTIFIER);
        assertThat(tokens).extracting(Token::text).containsExactly("J1", "j1", "abc123");
    }

    @Test
    void wordWithoutSeparatorAfterKeywordIsOneIdentifier() {
        List<Token> tokens = scan("Vari:integer;");

        assertThat(tokens.get(0)).isEqualTo(new Token(TokenType.IDENTIFIER, "Vari"));
    }

    @ParameterizedTest
    @CsvSource({
            "':=', ASSIGN",
            "'<>', NOT_EQUAL",
            "'<=', LESS_EQUAL",
            "'>=', GREATER_EQUAL",
            "'==', EQUAL_EQUAL"
    })
    void twoCharacterOperatorKeepsExactLexeme(String operator, TokenType expected) {
        List<Token> tokens = scan("a" + operator + "b");

        assertThat(tokens).hasSize(3);
        assertThat(tokens.get(1).type()).isEqualTo(expected);
        assertThat(tokens.get(1).text()).isEqualTo(operator);
    }

    @Test
    void singleCharacterOperatorsAndDelimiters() {
        List<Token> tokens = scan("+ - * / ; : ( ) , < >");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.SEMICOLON,
                TokenType.COLON, TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.COMMA,
                TokenType.LESS, TokenType.GREATER);
    }

    @Test
    void lookaheadPrefersLongestOperator() {
        List<Token> tokens = scan("<<=>=>");

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL, TokenType.GREATER);
    }

    @Test
    void loneEqualsIsAnErrorToken() {
        List<Token> tokens = scan("i=0");

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.IDENTIFIER, "i"),
                tuple(TokenType.ERROR, "="),
                tuple(TokenType.NUMBER, "0"));
    }

    @Test
    void colonFollowedByLoneEqualsSplitsCorrectly() {
        assertThat(scan(": =")).extracting(Token::type).containsExactly(TokenType.COLON, TokenType.ERROR);
    }

    @ParameterizedTest
    @ValueSource(strings = {"9i", "12abc", "0x1F", "1a2b"})
    void digitLedWordIsAnErrorToken(String word) {
        List<Token> tokens = scan(word + ":integer");

        assertThat(tokens.get(0)).isEqualTo(new Token(TokenType.ERROR, word));
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.COLON);
    }

    @Test
    void numberIsDigitsOnly() {
        List<Token> tokens = scan("12345;-7");

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.NUMBER, "12345"),
                tuple(TokenType.SEMICOLON, ";"),
                tuple(TokenType.MINUS, "-"),
                tuple(TokenType.NUMBER, "7"));
    }

    @Test
    void embeddedSymbolMakesWholeWordAnError() {
        List<Token> tokens = scan("i#:integer;");

        assertThat(tokens.get(0)).isEqualTo(new Token(TokenType.ERROR, "i#"));
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.COLON);
    }

    @Test
    void unknownCharacterIsSingleCharacterError() {
        List<Token> tokens = scan("# $x");

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.ERROR, "#"),
                tuple(TokenType.ERROR, "$"),
                tuple(TokenType.IDENTIFIER, "x"));
    }

    @Test
    void nonAsciiLetterIsNotAnIdentifierStart() {
        List<Token> tokens = scan("éa");

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.ERROR, TokenType.IDENTIFIER);
    }

    @Test
    void supplementaryCharacterIsOneErrorToken() {
        List<Token> tokens = scan(":=\uD83D\uDE00;");

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.ASSIGN, ":="),
                tuple(TokenType.ERROR, "\uD83D\uDE00"),
                tuple(TokenType.SEMICOLON, ";"));
    }

    @Test
    void unpairedSurrogateIsSingleCharacterError() {
        assertThat(scan("\uD83D")).extracting(Token::text).containsExactly("\uD83D");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "\t\n\r", " \u000B\f "})
    void emptyOrWhitespaceSourceYieldsNoTokens(String source) {
        assertThat(scan(source)).isEmpty();
    }

    @Test
    void whitespaceSeparatesWordsButIsNeverTokenized() {
        List<Token> tokens = scan("  begin\n\tend\r\n");

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.BEGIN, TokenType.END);
    }

    @Test
    void tokenizationIsDeterministic() {
        String source = "Var a,b:bool;Begin while ((a <> b)) do a:=b; end; End";

        assertThat(scan(source)).isEqualTo(scan(source));
    }

    @Test
    void scanStepReportsLexicalErrorAsDistinctOutcome() {
        Lexer lexer = new Lexer("=");

        ScanResult result = lexer.scanToken();

        assertThat(result).isEqualTo(new ScanResult.LexicalError("="));
        assertThat(result.toToken()).isEqualTo(new Token(TokenType.ERROR, "="));
    }

    @Test
    void scanStepReturnsScannedTokenForValidInput() {
        ScanResult result = new Lexer("begin").scanToken();

        assertThat(result).isInstanceOf(ScanResult.Scanned.class);
        assertThat(result.toToken()).isEqualTo(new Token(TokenType.BEGIN, "begin"));
    }
}
