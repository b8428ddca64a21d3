package com.houjicha;

import com.houjicha.ast.Position;
import com.houjicha.ast.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Indentation-sensitive tokenizer for houjicha source.
 *
 * <p>Every physical line starts with an indentation check against a stack of
 * open block widths: a deeper line emits one INDENT, a shallower line emits one
 * DEDENT per closed block. Blank lines never touch the stack; comment-only
 * lines do. Full-width operator characters (typed through a Japanese IME) are
 * recognized as the same tokens as their ASCII forms.</p>
 *
 * <p>Lexing never throws. Characters that cannot start a token are reported as
 * {@link LexError}s and skipped.</p>
 */
public class Lexer {
    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final int DEFAULT_FULL_WIDTH_SPACE_WIDTH = 2;

    private static final char FULL_WIDTH_SPACE = '　';
    private static final char NO_CHAR = '\0';

    private final String source;
    private final int length;
    private final int tabWidth;
    private final int fullWidthSpaceWidth;

    private int pos = 0;
    private int line = 0;
    private int column = 0;
    private boolean atLineStart = true;

    private final List<Token> tokens = new ArrayList<>();
    private final List<LexError> errors = new ArrayList<>();
    private final Deque<Integer> indentStack = new ArrayDeque<>();
    private boolean tokenized = false;

    public Lexer(String source) {
        this(source, DEFAULT_TAB_WIDTH, DEFAULT_FULL_WIDTH_SPACE_WIDTH);
    }

    public Lexer(String source, int tabWidth, int fullWidthSpaceWidth) {
        this.source = Objects.requireNonNull(source, "source");
        this.length = source.length();
        if (tabWidth < 1 || fullWidthSpaceWidth < 1) {
            throw new IllegalArgumentException("Indentation widths must be positive");
        }
        this.tabWidth = tabWidth;
        this.fullWidthSpaceWidth = fullWidthSpaceWidth;
        this.indentStack.push(0);
    }

    /**
     * Tokenize the whole source. The returned list always ends with the
     * trailing DEDENTs of blocks still open and a single EOF token.
     * Repeated calls return the same tokens.
     *
     * @return List of tokens
     */
    public List<Token> tokenize() {
        if (tokenized) {
            return Collections.unmodifiableList(tokens);
        }

        while (!isAtEnd()) {
            scanToken();
        }

        // Close every block still open at end of input
        while (indentStack.size() > 1) {
            indentStack.pop();
            addToken(TokenType.DEDENT, "", currentPosition());
        }
        addToken(TokenType.EOF, "", currentPosition());
        tokenized = true;

        LOG.debug("Tokenized {} characters into {} tokens ({} lexical errors)",
                  length, tokens.size(), errors.size());
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Lexical errors collected by {@link #tokenize()}, in source order.
     */
    public List<LexError> errors() {
        return Collections.unmodifiableList(errors);
    }

    private void scanToken() {
        if (atLineStart) {
            handleIndentation();
            return;
        }

        Position start = currentPosition();
        char c = advance();

        switch (c) {
            // Whitespace inside a line carries no meaning
            case ' ', '\t', FULL_WIDTH_SPACE -> { }
            case '\n' -> addToken(TokenType.NEWLINE, "\n", start);
            case '\r' -> {
                if (peek() == '\n') {
                    advance();
                }
                addToken(TokenType.NEWLINE, "\n", start);
            }
            case '/' -> {
                if (peek() == '/') {
                    advance();
                    scanComment(start);
                } else {
                    addError("Unexpected character '/'", start);
                }
            }
            case '#', '＃' -> addToken(TokenType.HASH, String.valueOf(c), start);
            case '^', '＾' -> addToken(TokenType.CARET, String.valueOf(c), start);
            case ':' -> {
                if (peek() == ':') {
                    advance();
                    addToken(TokenType.DOUBLE_COLON, "::", start);
                } else {
                    addToken(TokenType.COLON, ":", start);
                }
            }
            case '：' -> {
                if (peek() == '：') {
                    advance();
                    addToken(TokenType.DOUBLE_COLON, "：：", start);
                } else {
                    addToken(TokenType.COLON, "：", start);
                }
            }
            case '<' -> twoCharOperator(c, '=', TokenType.ARROW_LEFT, "<=", start);
            case '>' -> twoCharOperator(c, '>', TokenType.ARROW_RIGHT, ">>", start);
            case '~' -> twoCharOperator(c, '>', TokenType.TILDE_ARROW, "~>", start);
            case '=' -> twoCharOperator(c, '>', TokenType.IMPLIES, "=>", start);
            case '?', '？' -> addToken(TokenType.QUESTION, String.valueOf(c), start);
            case '%', '％' -> addToken(TokenType.PERCENT, String.valueOf(c), start);
            case '@', '＠' -> addToken(TokenType.AT, String.valueOf(c), start);
            case ';', '；' -> addToken(TokenType.SEMICOLON, String.valueOf(c), start);
            case '&', '＆' -> addToken(TokenType.AND, String.valueOf(c), start);
            case '|', '｜' -> addToken(TokenType.OR, String.valueOf(c), start);
            case '+', '＋' -> addToken(TokenType.PLUS, String.valueOf(c), start);
            case '!', '！' -> addToken(TokenType.EXCLAIM, String.valueOf(c), start);
            case '(', '（' -> addToken(TokenType.LPAREN, String.valueOf(c), start);
            case ')', '）' -> addToken(TokenType.RPAREN, String.valueOf(c), start);
            case '「' -> addToken(TokenType.LBRACKET_JP, "「", start);
            case '」' -> addToken(TokenType.RBRACKET_JP, "」", start);
            case '*', '＊' -> addToken(TokenType.ASTERISK, String.valueOf(c), start);
            case '$', '＄' -> addToken(TokenType.DOLLAR, String.valueOf(c), start);
            case '\\' -> scanEscape(start);
            default -> scanText(start, String.valueOf(c));
        }
    }

    /**
     * Emit {@code type} when the next character is {@code second}; otherwise
     * the first character starts ordinary text.
     */
    private void twoCharOperator(char first, char second, TokenType type, String text, Position start) {
        if (peek() == second) {
            advance();
            addToken(type, text, start);
        } else {
            scanText(start, String.valueOf(first));
        }
    }

    private void scanEscape(Position start) {
        char next = peek();
        if (isAtEnd() || next == '\n' || next == '\r') {
            addError("Escape character '\\' must be followed by a character", start);
            return;
        }
        advance();
        if (next == '&') {
            // \& still lexes as a conjunction
            addToken(TokenType.AND, "\\&", start);
        } else {
            scanText(start, "\\" + next);
        }
    }

    private void handleIndentation() {
        Position start = currentPosition();
        int width = 0;

        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') {
                width += 1;
            } else if (c == '\t') {
                width += tabWidth;
            } else if (c == FULL_WIDTH_SPACE) {
                width += fullWidthSpaceWidth;
            } else {
                break;
            }
            advance();
        }
        atLineStart = false;

        // Blank lines do not open or close blocks; comment-only lines do
        if (isAtEnd() || peek() == '\n' || peek() == '\r') {
            return;
        }

        int current = indentStack.peek();
        if (width > current) {
            indentStack.push(width);
            addToken(TokenType.INDENT, "", start);
        } else if (width < current) {
            while (indentStack.size() > 1 && indentStack.peek() > width) {
                indentStack.pop();
                addToken(TokenType.DEDENT, "", start);
            }
        }
    }

    private void scanComment(Position start) {
        int from = pos;
        while (!isAtEnd() && peek() != '\n' && peek() != '\r') {
            advance();
        }
        addToken(TokenType.COMMENT, source.substring(from, pos).strip(), start);
    }

    /**
     * Accumulate ordinary text up to the next special character or line break.
     * The word {@code as} on its own becomes the AS keyword.
     */
    private void scanText(Position start, String initial) {
        StringBuilder text = new StringBuilder(initial);
        while (!isAtEnd()) {
            char c = peek();
            if (isSpecialChar(c) || c == '\n' || c == '\r') {
                break;
            }
            text.append(advance());
        }

        String trimmed = text.toString().strip();
        if (trimmed.equals("as")) {
            addToken(TokenType.AS, trimmed, start);
        } else if (!trimmed.isEmpty()) {
            addToken(TokenType.TEXT, trimmed, start);
        }
    }

    private static boolean isSpecialChar(char c) {
        return switch (c) {
            case '#', '＃', '^', '＾', ':', '：', '<', '>', '?', '？',
                 '%', '％', '@', '＠', '~', '=', '&', '＆', '|', '｜',
                 '+', '＋', '!', '！', '(', '（', ')', '）',
                 '「', '」', '$', '＄', '/', '\\', ';', '；', '*', '＊',
                 ' ', '\t', FULL_WIDTH_SPACE -> true;
            default -> false;
        };
    }

    // Helper methods

    private boolean isAtEnd() {
        return pos >= length;
    }

    private char peek() {
        return pos < length ? source.charAt(pos) : NO_CHAR;
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n' || (c == '\r' && peek() != '\n')) {
            line++;
            column = 0;
            atLineStart = true;
        } else {
            column++;
        }
        return c;
    }

    private Position currentPosition() {
        return new Position(line, column, pos);
    }

    private void addToken(TokenType type, String value, Position start) {
        tokens.add(new Token(type, value, Range.of(start, currentPosition())));
    }

    private void addError(String message, Position start) {
        errors.add(new LexError(message, Range.of(start, currentPosition())));
    }
}
