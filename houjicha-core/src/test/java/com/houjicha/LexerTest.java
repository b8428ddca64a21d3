package com.houjicha;

import com.houjicha.ast.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;

import static com.houjicha.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return new Lexer(source).tokenize().stream()
            .map(Token::type)
            .collect(Collectors.toList());
    }

    @Test
    void testSimpleClaim() {
        List<Token> tokens = new Lexer("#窃盗罪").tokenize();

        assertEquals(List.of(HASH, TEXT, EOF), tokens.stream().map(Token::type).collect(Collectors.toList()));
        assertEquals("窃盗罪", tokens.get(1).value());
        assertEquals(new Position(0, 1, 1), tokens.get(1).start());
        assertEquals(new Position(0, 4, 4), tokens.get(1).end());
    }

    @Test
    void testIndentAndDedent() {
        assertEquals(List.of(TEXT, NEWLINE, INDENT, TEXT, NEWLINE, DEDENT, TEXT, EOF),
                     types("a\n    b\nc"));
    }

    @Test
    void testTrailingDedentsAtEndOfInput() {
        assertEquals(List.of(TEXT, NEWLINE, INDENT, TEXT, NEWLINE, INDENT, TEXT, DEDENT, DEDENT, EOF),
                     types("a\n    b\n        c"));
    }

    @Test
    @DisplayName("Blank lines never open or close blocks")
    void testBlankLinesIgnoredForIndentation() {
        assertEquals(List.of(TEXT, NEWLINE, INDENT, TEXT, NEWLINE, NEWLINE, TEXT, DEDENT, EOF),
                     types("a\n    b\n\n    c"));
        assertEquals(List.of(TEXT, NEWLINE, INDENT, TEXT, NEWLINE, NEWLINE, TEXT, DEDENT, EOF),
                     types("a\n    b\n  \n    c"));
    }

    @Test
    @DisplayName("Comment-only lines take part in indentation")
    void testCommentLineAffectsIndentation() {
        assertEquals(List.of(TEXT, NEWLINE, INDENT, COMMENT, NEWLINE, DEDENT, TEXT, EOF),
                     types("a\n    // note\nb"));
    }

    @Test
    void testTabAndFullWidthSpaceWidths() {
        // tab = 4, U+3000 = 2: both lines sit at width 4
        assertEquals(List.of(TEXT, NEWLINE, INDENT, TEXT, NEWLINE, TEXT, DEDENT, EOF),
                     types("a\n\tb\n　　c"));
    }

    @Test
    void testCustomIndentationWidths() {
        List<TokenType> actual = new Lexer("a\n\tb\n  c", 2, 2).tokenize().stream()
            .map(Token::type)
            .collect(Collectors.toList());
        assertEquals(List.of(TEXT, NEWLINE, INDENT, TEXT, NEWLINE, TEXT, DEDENT, EOF), actual);
    }

    @Test
    void testInvalidIndentationWidths() {
        assertThrows(IllegalArgumentException.class, () -> new Lexer("a", 0, 2));
        assertThrows(IllegalArgumentException.class, () -> new Lexer("a", 4, -1));
        assertThrows(NullPointerException.class, () -> new Lexer(null));
    }

    @ParameterizedTest
    @CsvSource({
        "'#', HASH",
        "＃, HASH",
        "^, CARET",
        "＾, CARET",
        ":, COLON",
        "：, COLON",
        "::, DOUBLE_COLON",
        "：：, DOUBLE_COLON",
        "<=, ARROW_LEFT",
        ">>, ARROW_RIGHT",
        "~>, TILDE_ARROW",
        "=>, IMPLIES",
        "？, QUESTION",
        "％, PERCENT",
        "＠, AT",
        "；, SEMICOLON",
        "＆, AND",
        "｜, OR",
        "＋, PLUS",
        "！, EXCLAIM",
        "（, LPAREN",
        "）, RPAREN",
        "「, LBRACKET_JP",
        "」, RBRACKET_JP",
        "＊, ASTERISK",
        "＄, DOLLAR",
        "as, AS"
    })
    void testOperators(String source, TokenType expected) {
        List<Token> tokens = new Lexer(source).tokenize();
        assertEquals(2, tokens.size(), "Tokens: " + tokens);
        assertEquals(expected, tokens.get(0).type());
        assertEquals(source, tokens.get(0).value());
    }

    @Test
    void testIncompleteTwoCharOperatorsAreText() {
        List<Token> tokens = new Lexer("a < b").tokenize();
        assertEquals(List.of(TEXT, TEXT, TEXT, EOF), tokens.stream().map(Token::type).collect(Collectors.toList()));
        assertEquals("<", tokens.get(1).value());
    }

    @Test
    void testAsOnlyAsWholeWord() {
        assertEquals(List.of(TEXT, EOF), types("ask"));
        assertEquals(List.of(PERCENT, TEXT, AS, TEXT, EOF), types("%規範 as 定数"));
    }

    @Test
    void testComment() {
        List<Token> tokens = new Lexer("#a // 補足説明  ").tokenize();
        assertEquals(List.of(HASH, TEXT, COMMENT, EOF), tokens.stream().map(Token::type).collect(Collectors.toList()));
        assertEquals("補足説明", tokens.get(2).value());
    }

    @Test
    void testLoneSlashIsError() {
        Lexer lexer = new Lexer("a / b");
        List<Token> tokens = lexer.tokenize();

        assertEquals(List.of(TEXT, TEXT, EOF), tokens.stream().map(Token::type).collect(Collectors.toList()));
        assertEquals(1, lexer.errors().size());
        assertEquals(new Position(0, 2, 2), lexer.errors().get(0).range().start());
    }

    @Test
    void testEscapedAmpersandIsConjunction() {
        List<Token> tokens = new Lexer("a \\& b").tokenize();
        assertEquals(AND, tokens.get(1).type());
        assertEquals("\\&", tokens.get(1).value());
    }

    @Test
    void testOtherEscapesAreText() {
        List<Token> tokens = new Lexer("\\#tag").tokenize();
        assertEquals(TEXT, tokens.get(0).type());
        assertEquals("\\#tag", tokens.get(0).value());
    }

    @Test
    void testDanglingEscapeIsError() {
        Lexer lexer = new Lexer("a\\");
        lexer.tokenize();
        assertEquals(1, lexer.errors().size());
    }

    @Test
    void testLineBreakVariants() {
        List<Token> crlf = new Lexer("a\r\nb").tokenize();
        assertEquals(List.of(TEXT, NEWLINE, TEXT, EOF), crlf.stream().map(Token::type).collect(Collectors.toList()));
        assertEquals(new Position(1, 0, 3), crlf.get(2).start());

        List<Token> cr = new Lexer("a\rb").tokenize();
        assertEquals(List.of(TEXT, NEWLINE, TEXT, EOF), cr.stream().map(Token::type).collect(Collectors.toList()));
        assertEquals(1, cr.get(2).start().line());
    }

    @Test
    void testTrailingIndentationAtEndOfInput() {
        assertEquals(List.of(TEXT, NEWLINE, EOF), types("a\n    "));
    }

    @Test
    void testTokenizeIsRepeatable() {
        Lexer lexer = new Lexer("#a:\n    (b)");
        List<Token> first = lexer.tokenize();
        List<Token> second = lexer.tokenize();
        assertEquals(first, second);
    }

    @Test
    void testEmptySource() {
        assertEquals(List.of(EOF), types(""));
    }
}
