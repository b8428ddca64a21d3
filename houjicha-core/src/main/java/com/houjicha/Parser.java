package com.houjicha;

import com.houjicha.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recursive-descent parser for houjicha documents.
 *
 * <p>The parser never throws on malformed input. Every problem is recorded as a
 * {@link ParseError} and parsing continues with a local recovery: drop the
 * offending token, skip to the end of the line, or skip a whole orphaned
 * indented block. Every loop consumes at least one token per iteration, so
 * parsing terminates in time linear in the number of tokens.</p>
 *
 * <p>A parser instance owns the {@link ConstantTable} of one parse and must not
 * be shared between threads or reused for another source.</p>
 */
public class Parser {
    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    // Compound facts, sub-norm chains and indented blocks share one recursion budget;
    // deeper input is cut off with an error
    private static final int MAX_NESTING = 64;

    private final Lexer lexer;
    private List<Token> tokens = List.of();
    private int current = 0;
    private int nesting = 0;
    private final List<ParseError> errors = new ArrayList<>();
    private final ConstantTable constants = new ConstantTable();
    private ParseResult result;

    public Parser(String source) {
        this(new Lexer(source));
    }

    public Parser(Lexer lexer) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
    }

    public static ParseResult parse(String source) {
        return new Parser(source).parse();
    }

    public ParseResult parse() {
        if (result != null) {
            return result;
        }

        tokens = lexer.tokenize();
        for (LexError lexError : lexer.errors()) {
            errors.add(ParseError.of(lexError));
        }

        Document document = parseDocument();
        result = new ParseResult(document, errors);

        LOG.debug("Parsed {} top-level nodes, {} constants, {} errors",
                  document.children().size(), constants.size(), errors.size());
        return result;
    }

    /**
     * The constants registered so far. After {@link #parse()} this is the
     * same content as {@link Document#constants()}.
     */
    public ConstantTable constants() {
        return constants;
    }

    // ========================================================================
    // Document level
    // ========================================================================

    private Document parseDocument() {
        Position start = peek().start();
        List<DocumentChild> children = new ArrayList<>();

        skipNewlines();

        while (!isAtEnd()) {
            Token token = peek();
            switch (token.type()) {
                case DOUBLE_COLON -> children.add(parseNamespace());
                case COMMENT -> children.add(parseComment());
                case HASH, PLUS, EXCLAIM -> children.add(parseClaim());
                case NEWLINE -> advance();
                case SEMICOLON -> {
                    // Reasons outside a claim are legal but belong to nothing
                    ReasonStatement orphan = parseReasonStatement();
                    LOG.debug("Ignoring top-level reason statement '{}'", orphan.content());
                }
                case INDENT -> {
                    error("Indented content must appear inside a claim (#) or namespace (::)");
                    skipOrphanedIndentedBlock();
                }
                case LPAREN, LBRACKET_JP, PERCENT, DOLLAR, QUESTION, ARROW_LEFT, ARROW_RIGHT -> {
                    error(misplacedMessage(token.type()));
                    skipUntilNewline();
                }
                default -> {
                    error("Unexpected " + describe(token) + " at document level");
                    advance();
                }
            }
        }

        return new Document(Range.of(start, peek().end()), children, constants.asMap());
    }

    private static String misplacedMessage(TokenType type) {
        return switch (type) {
            case LPAREN, LBRACKET_JP -> "Requirement ( ) must appear inside a claim (#)";
            case PERCENT -> "Norm (%) must appear inside a claim (#)";
            case DOLLAR -> "Constant reference ($) must appear inside a claim (#)";
            case QUESTION -> "Issue (?) must appear inside a claim (#)";
            case ARROW_LEFT -> "Fact (<=) must appear inside a claim (#)";
            case ARROW_RIGHT -> "Effect (>>) must follow a claim (#)";
            default -> "Unexpected " + type + " at document level";
        };
    }

    private Namespace parseNamespace() {
        Position start = advance().start(); // ::
        String name = readTextUntil(TokenType.NEWLINE);
        List<NamespaceChild> children = new ArrayList<>();

        skipNewlines();

        if (match(TokenType.INDENT)) {
            while (!isAtEnd() && !check(TokenType.DEDENT)) {
                Token token = peek();
                switch (token.type()) {
                    case COMMENT -> children.add(parseComment());
                    case HASH, PLUS, EXCLAIM -> children.add(parseClaim());
                    case NEWLINE -> advance();
                    case DOUBLE_COLON -> {
                        error("Namespaces cannot be nested");
                        skipUntilNewline();
                        skipNewlines();
                        if (check(TokenType.INDENT)) {
                            skipOrphanedIndentedBlock();
                        }
                    }
                    case LPAREN, LBRACKET_JP, PERCENT, DOLLAR, QUESTION, ARROW_LEFT, ARROW_RIGHT -> {
                        error(misplacedMessage(token.type()));
                        skipUntilNewline();
                    }
                    default -> recoverInBlock("namespace");
                }
            }
            match(TokenType.DEDENT);
        }

        return new Namespace(rangeFrom(start), name, children);
    }

    private Comment parseComment() {
        Token token = advance();
        return new Comment(token.range(), token.value());
    }

    private ReasonStatement parseReasonStatement() {
        Position start = advance().start(); // ;
        String content = readTextUntil(TokenType.NEWLINE);
        return new ReasonStatement(rangeFrom(start), content);
    }

    // ========================================================================
    // Claims
    // ========================================================================

    private Claim parseClaim() {
        Position start = peek().start();
        Concluded concluded = parseConclusionMarker();

        expect(TokenType.HASH, "Claim requires '#'");

        String name = readTextUntil(TokenType.CARET, TokenType.ARROW_LEFT, TokenType.COLON, TokenType.NEWLINE);

        Reference reference = null;
        if (match(TokenType.CARET)) {
            reference = parseReference(TokenType.ARROW_LEFT, TokenType.COLON, TokenType.NEWLINE);
        }

        Fact fact = null;
        if (match(TokenType.ARROW_LEFT)) {
            fact = parseFact();
        }

        List<Requirement> requirements = new ArrayList<>();
        List<ReasonStatement> reasonStatements = new ArrayList<>();
        Effect effect = null;

        boolean hasBody = match(TokenType.COLON);
        skipNewlines();

        if (hasBody && match(TokenType.INDENT)) {
            while (!isAtEnd() && !check(TokenType.DEDENT)) {
                if (parseRequirementEntry(requirements)) {
                    continue;
                }
                switch (peek().type()) {
                    case ARROW_RIGHT -> effect = parseEffect();
                    case SEMICOLON -> reasonStatements.add(parseReasonStatement());
                    case NEWLINE, COMMENT -> advance();
                    default -> recoverInBlock("claim");
                }
            }
            match(TokenType.DEDENT);
        }

        // The effect may also follow the body at the claim's own indentation
        if (check(TokenType.ARROW_RIGHT)) {
            effect = parseEffect();
        }

        return new Claim(rangeFrom(start), concluded, name, reference, fact,
                         requirements, effect, reasonStatements);
    }

    private Reference parseReference(TokenType... stops) {
        Position start = peek().start();
        String citation = readTextUntil(stops);
        return new Reference(rangeFrom(start), citation);
    }

    private Effect parseEffect() {
        Position start = peek().start();
        expect(TokenType.ARROW_RIGHT, "Effect requires '>>'");
        String content = readTextUntil(TokenType.NEWLINE);
        return new Effect(rangeFrom(start), content);
    }

    /**
     * Parse one requirement-like entry of a block: a bracketed requirement, a
     * norm used as a requirement, or an issue used as a requirement.
     *
     * @return false if the current token starts none of them
     */
    private boolean parseRequirementEntry(List<Requirement> into) {
        boolean marker = check(TokenType.PLUS) || check(TokenType.EXCLAIM);
        if (!isRequirementStart() && !isNormStart() && !check(TokenType.QUESTION) && !marker) {
            return false;
        }

        if (nesting >= MAX_NESTING) {
            error("Blocks are nested too deeply");
            skipUntilNewline();
            skipNewlines();
            if (check(TokenType.INDENT)) {
                skipOrphanedIndentedBlock();
            }
            return true;
        }

        nesting++;
        try {
            if (isRequirementStart()) {
                into.add(parseRequirement());
            } else if (isNormStart()) {
                into.add(parseNormAsRequirement());
            } else if (check(TokenType.QUESTION)) {
                into.add(parseIssueAsRequirement());
            } else {
                // A marker without %, $ or a bracket; parsed as a norm so the missing % is reported
                into.add(parseNormAsRequirement());
            }
        } finally {
            nesting--;
        }
        return true;
    }

    private boolean isRequirementStart() {
        if (isRequirementOpen(peek().type())) {
            return true;
        }
        return (check(TokenType.PLUS) || check(TokenType.EXCLAIM)) && isRequirementOpen(peek(1).type());
    }

    private static boolean isRequirementOpen(TokenType type) {
        return type == TokenType.LPAREN || type == TokenType.LBRACKET_JP;
    }

    private boolean isNormStart() {
        if (check(TokenType.PERCENT) || check(TokenType.DOLLAR)) {
            return true;
        }
        TokenType next = peek(1).type();
        return (check(TokenType.PLUS) || check(TokenType.EXCLAIM))
            && (next == TokenType.PERCENT || next == TokenType.DOLLAR);
    }

    // Any token a norm production can begin with, marker included
    private boolean isNormOpening() {
        return check(TokenType.PERCENT) || check(TokenType.DOLLAR)
            || check(TokenType.PLUS) || check(TokenType.EXCLAIM);
    }

    // ========================================================================
    // Requirements
    // ========================================================================

    private Requirement parseRequirement() {
        Position start = peek().start();
        Concluded concluded = parseConclusionMarker();

        Token open = peek();
        TokenType close;
        if (match(TokenType.LBRACKET_JP)) {
            close = TokenType.RBRACKET_JP;
        } else {
            expect(TokenType.LPAREN, "Requirement requires '('");
            close = TokenType.RPAREN;
        }

        // Requirement names are joined without separators
        StringBuilder name = new StringBuilder();
        Position lastEnd = open.end();
        while (!isAtEnd() && !check(close) && !check(TokenType.NEWLINE)) {
            Token token = advance();
            if (token.type() != TokenType.COMMENT) {
                name.append(token.value());
                lastEnd = token.end();
            }
        }

        if (check(close)) {
            advance();
        } else {
            String closeText = close == TokenType.RBRACKET_JP ? "」" : ")";
            error("Missing closing '" + closeText + "' for requirement", Range.of(open.start(), lastEnd));
        }

        Norm norm = null;
        Fact fact = null;

        // Inline forms: (name): %norm <= fact, (name): $const, (name): <= fact, (name) <= fact
        if (match(TokenType.COLON)) {
            if (isNormOpening()) {
                norm = parseNorm();
                fact = norm.fact();
            } else if (match(TokenType.ARROW_LEFT)) {
                fact = parseFact();
            }
        } else if (match(TokenType.ARROW_LEFT)) {
            fact = parseFact();
        }

        skipNewlines();

        List<Requirement> subRequirements = new ArrayList<>();
        List<ReasonStatement> reasonStatements = new ArrayList<>();

        if (match(TokenType.INDENT)) {
            while (!isAtEnd() && !check(TokenType.DEDENT)) {
                if (parseRequirementEntry(subRequirements)) {
                    continue;
                }
                switch (peek().type()) {
                    case ARROW_LEFT -> {
                        advance();
                        fact = parseFact();
                    }
                    case SEMICOLON -> reasonStatements.add(parseReasonStatement());
                    case NEWLINE, COMMENT -> advance();
                    default -> recoverInBlock("requirement");
                }
            }
            match(TokenType.DEDENT);
        }

        return new Requirement(rangeFrom(start), concluded, name.toString().strip(), norm, fact,
                               subRequirements, null, reasonStatements);
    }

    private Requirement parseNormAsRequirement() {
        Position start = peek().start();
        Norm norm = parseNorm();

        skipNewlines();

        List<Requirement> subRequirements = new ArrayList<>();
        List<ReasonStatement> reasonStatements = new ArrayList<>();

        if (match(TokenType.INDENT)) {
            while (!isAtEnd() && !check(TokenType.DEDENT)) {
                if (parseRequirementEntry(subRequirements)) {
                    continue;
                }
                switch (peek().type()) {
                    case ARROW_LEFT -> {
                        advance();
                        norm = norm.withFact(parseFact());
                    }
                    case SEMICOLON -> reasonStatements.add(parseReasonStatement());
                    case NEWLINE, COMMENT -> advance();
                    default -> recoverInBlock("norm");
                }
            }
            match(TokenType.DEDENT);
        }

        return new Requirement(rangeFrom(start), norm.concluded(), norm.content(), norm, norm.fact(),
                               subRequirements, null, reasonStatements);
    }

    // ========================================================================
    // Norms and constants
    // ========================================================================

    private Norm parseNorm() {
        Position start = peek().start();
        Concluded concluded = parseConclusionMarker();

        if (check(TokenType.DOLLAR)) {
            return parseConstantReference(start, advance(), concluded);
        }

        expect(TokenType.PERCENT, "Norm requires '%'");

        String content = readTextUntil(TokenType.CARET, TokenType.ARROW_LEFT, TokenType.COLON,
                                       TokenType.AS, TokenType.SEMICOLON, TokenType.NEWLINE);

        Reference reference = null;
        if (match(TokenType.CARET)) {
            reference = parseReference(TokenType.ARROW_LEFT, TokenType.COLON, TokenType.AS,
                                       TokenType.SEMICOLON, TokenType.NEWLINE);
        }

        Norm subNorm = null;
        Fact fact = null;

        if (match(TokenType.COLON) && isNormOpening()) {
            if (nesting >= MAX_NESTING) {
                error("Norms are nested too deeply");
                skipUntilLineEnd();
            } else {
                nesting++;
                try {
                    subNorm = parseNorm();
                } finally {
                    nesting--;
                }
                // The sub-norm's application carries over to this norm
                if (subNorm.fact() != null) {
                    fact = subNorm.fact();
                }
            }
        }

        if (match(TokenType.ARROW_LEFT)) {
            fact = parseFact();
        }

        String constantName = null;
        if (check(TokenType.AS)) {
            Token as = advance();
            String name = readTextUntil(TokenType.ARROW_LEFT, TokenType.NEWLINE);

            if (match(TokenType.ARROW_LEFT)) {
                fact = parseFact();
            }

            if (name.isEmpty()) {
                error("Constant name expected after 'as'", as.range());
            } else {
                constantName = name;
                Norm snapshot = new Norm(rangeFrom(start), concluded, content, reference, subNorm, fact,
                                         List.of(), null, null);
                constants.define(new ConstantDefinition(snapshot.range(), name, snapshot));
            }
        }

        return new Norm(rangeFrom(start), concluded, content, reference, subNorm, fact,
                        List.of(), constantName, null);
    }

    /**
     * Expand {@code $name} from the constants defined so far. An unknown name
     * is reported and kept as the norm's content.
     */
    private Norm parseConstantReference(Position start, Token dollar, Concluded concluded) {
        String name = readTextUntil(TokenType.ARROW_LEFT, TokenType.COLON, TokenType.SEMICOLON, TokenType.NEWLINE);
        Range nameRange = Range.of(dollar.start(), previous().end());

        String content = name;
        Reference reference = null;

        Optional<ConstantDefinition> definition = constants.lookup(name);
        if (definition.isPresent()) {
            content = definition.get().value().content();
            reference = definition.get().value().reference();
        } else if (name.isEmpty()) {
            error("Constant name expected after '$'", nameRange);
        } else {
            error("Undefined constant: " + name, nameRange);
        }

        Fact fact = null;
        if (match(TokenType.ARROW_LEFT)) {
            fact = parseFact();
        }

        return new Norm(rangeFrom(start), concluded, content, reference, null, fact,
                        List.of(), null, name);
    }

    // ========================================================================
    // Issues
    // ========================================================================

    private Requirement parseIssueAsRequirement() {
        Position start = peek().start();
        Issue issue = parseIssue();
        return new Requirement(rangeFrom(start), issue.norm().concluded(), issue.question(), null, null,
                               List.of(), issue, List.of());
    }

    private Issue parseIssue() {
        Position start = peek().start();
        expect(TokenType.QUESTION, "Issue requires '?'");

        String question = readTextUntil(TokenType.TILDE_ARROW, TokenType.IMPLIES, TokenType.NEWLINE);

        List<Reason> reasons = List.of();
        if (match(TokenType.TILDE_ARROW)) {
            reasons = parseReasons();
        }

        Norm norm;
        if (match(TokenType.IMPLIES)) {
            norm = parseNorm();
        } else {
            error("Issue requires '=>' followed by a norm");
            norm = isNormOpening()
                ? parseNorm()
                : new Norm(Range.at(peek().start()), Concluded.NONE, "", null, null, null, List.of(), null, null);
        }

        skipNewlines();

        // Entries of an issue's block belong to the issue's norm
        if (match(TokenType.INDENT)) {
            List<Requirement> subRequirements = new ArrayList<>(norm.subRequirements());
            while (!isAtEnd() && !check(TokenType.DEDENT)) {
                if (parseRequirementEntry(subRequirements)) {
                    continue;
                }
                if (check(TokenType.NEWLINE) || check(TokenType.COMMENT)) {
                    advance();
                } else {
                    recoverInBlock("issue");
                }
            }
            match(TokenType.DEDENT);
            if (!subRequirements.isEmpty()) {
                norm = norm.withSubRequirements(subRequirements);
            }
        }

        return new Issue(rangeFrom(start), question, reasons, norm, null);
    }

    private List<Reason> parseReasons() {
        Position start = peek().start();
        List<Reason> reasons = new ArrayList<>();

        if (!check(TokenType.LPAREN)) {
            String content = readTextUntil(TokenType.IMPLIES, TokenType.NEWLINE);
            reasons.add(new Reason(rangeFrom(start), content, null));
            return reasons;
        }

        Token open = advance();
        String first = readTextUntil(TokenType.AND, TokenType.OR, TokenType.RPAREN, TokenType.NEWLINE);
        reasons.add(new Reason(rangeFrom(start), first, null));

        while (check(TokenType.AND) || check(TokenType.OR)) {
            LogicalOperator operator = advance().type() == TokenType.AND ? LogicalOperator.AND : LogicalOperator.OR;
            Position reasonStart = peek().start();
            String content = readTextUntil(TokenType.AND, TokenType.OR, TokenType.RPAREN, TokenType.NEWLINE);
            reasons.add(new Reason(rangeFrom(reasonStart), content, operator));
        }

        if (!match(TokenType.RPAREN)) {
            error("Missing closing ')' for reasons", Range.of(open.start(), previous().end()));
        }
        return reasons;
    }

    // ========================================================================
    // Facts
    // ========================================================================

    private Fact parseFact() {
        Position start = peek().start();

        if (check(TokenType.LPAREN)) {
            return parseCompoundFact(advance());
        }

        StringBuilder content = new StringBuilder();
        Evaluation evaluation = null;

        while (!isAtEnd() && !isFactStop()) {
            if (match(TokenType.AT)) {
                Evaluation parsed = parseEvaluation();
                // Only the first evaluation is kept; text may continue after it
                if (evaluation == null) {
                    evaluation = parsed;
                }
                continue;
            }
            Token token = advance();
            if (token.type() != TokenType.COMMENT) {
                appendWord(content, token.value());
            }
        }

        return Fact.leaf(rangeFrom(start), content.toString(), evaluation);
    }

    private boolean isFactStop() {
        return switch (peek().type()) {
            case COLON, AND, OR, RPAREN, ARROW_RIGHT, SEMICOLON, NEWLINE -> true;
            default -> false;
        };
    }

    private Fact parseCompoundFact(Token open) {
        if (nesting >= MAX_NESTING) {
            error("Compound facts are nested too deeply", open.range());
            skipUntilLineEnd();
            return Fact.leaf(rangeFrom(open.start()), "", null);
        }

        nesting++;
        try {
            List<Fact> children = new ArrayList<>();
            LogicalOperator operator = null;

            children.add(parseFact());
            while (check(TokenType.AND) || check(TokenType.OR)) {
                // A mixed chain keeps only the last connective
                operator = advance().type() == TokenType.AND ? LogicalOperator.AND : LogicalOperator.OR;
                children.add(parseFact());
            }

            if (!match(TokenType.RPAREN)) {
                error("Missing closing ')' for compound fact", Range.of(open.start(), previous().end()));
            }

            Evaluation evaluation = null;
            if (match(TokenType.AT)) {
                evaluation = parseEvaluation();
            }

            return Fact.compound(rangeFrom(open.start()), operator, children, evaluation);
        } finally {
            nesting--;
        }
    }

    private Evaluation parseEvaluation() {
        Position start = peek().start();
        String content = readTextUntil(TokenType.COLON, TokenType.AND, TokenType.OR, TokenType.RPAREN,
                                       TokenType.ARROW_RIGHT, TokenType.AT, TokenType.SEMICOLON, TokenType.NEWLINE);
        return new Evaluation(rangeFrom(start), content);
    }

    // ========================================================================
    // Recovery
    // ========================================================================

    /**
     * Report the token that cannot start an entry of the current block and
     * skip past it: a stray INDENT skips the nested block it opens, anything
     * else skips the rest of its line.
     */
    private void recoverInBlock(String block) {
        Token token = peek();
        if (token.type() == TokenType.INDENT) {
            error("Unexpected indentation in " + block + " block");
            skipOrphanedIndentedBlock();
            return;
        }
        error("Unexpected " + describe(token) + " in " + block + " block");
        skipUntilNewline();
    }

    private void skipOrphanedIndentedBlock() {
        advance(); // INDENT
        int depth = 1;
        while (!isAtEnd() && depth > 0) {
            if (check(TokenType.INDENT)) {
                depth++;
            } else if (check(TokenType.DEDENT)) {
                depth--;
            }
            advance();
        }
    }

    private void skipUntilNewline() {
        skipUntilLineEnd();
        match(TokenType.NEWLINE);
    }

    private void skipUntilLineEnd() {
        while (!isAtEnd() && !check(TokenType.NEWLINE)) {
            advance();
        }
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case TEXT, AS -> "text '" + token.value() + "'";
            case INDENT -> "indentation";
            case DEDENT -> "end of block";
            case NEWLINE -> "end of line";
            case EOF -> "end of input";
            default -> "'" + token.value() + "'";
        };
    }

    // ========================================================================
    // Helper methods
    // ========================================================================

    private Concluded parseConclusionMarker() {
        if (match(TokenType.PLUS)) {
            return Concluded.POSITIVE;
        }
        if (match(TokenType.EXCLAIM)) {
            return Concluded.NEGATIVE;
        }
        return Concluded.NONE;
    }

    /**
     * Join token values with single spaces up to one of {@code stops}, the end
     * of the line or the end of input. Trailing comments are dropped.
     */
    private String readTextUntil(TokenType... stops) {
        StringBuilder text = new StringBuilder();
        while (!isAtEnd() && !checkAny(stops) && !check(TokenType.NEWLINE)) {
            Token token = advance();
            if (token.type() != TokenType.COMMENT) {
                appendWord(text, token.value());
            }
        }
        return text.toString();
    }

    private static void appendWord(StringBuilder text, String word) {
        if (word.isEmpty()) {
            return;
        }
        if (text.length() > 0) {
            text.append(' ');
        }
        text.append(word);
    }

    private void skipNewlines() {
        while (check(TokenType.NEWLINE) || isTrailingComment()) {
            advance();
        }
    }

    // A comment that follows other tokens on the same line
    private boolean isTrailingComment() {
        if (!check(TokenType.COMMENT) || current == 0) {
            return false;
        }
        TokenType before = previous().type();
        return before != TokenType.NEWLINE && before != TokenType.INDENT && before != TokenType.DEDENT;
    }

    private Range rangeFrom(Position start) {
        return Range.of(start, peek().start());
    }

    private void error(String message) {
        errors.add(new ParseError(message, peek().range()));
    }

    private void error(String message, Range range) {
        errors.add(new ParseError(message, range));
    }

    /**
     * Consume a token of {@code type}, or report {@code message} without
     * consuming anything. Returns the consumed or the mismatched token.
     */
    private Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        error(message);
        return peek();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkAny(TokenType... types) {
        TokenType actual = peek().type();
        for (TokenType type : types) {
            if (actual == type) {
                return true;
            }
        }
        return false;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peek(int offset) {
        int index = current + offset;
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    private Token previous() {
        return tokens.get(Math.max(current - 1, 0));
    }
}
