package com.houjicha;

import com.houjicha.ast.Document;

import java.util.List;

/**
 * Outcome of one parse: the best-effort document and every lexical and
 * syntactic error, lexical errors first.
 */
public record ParseResult(Document document, List<ParseError> errors) {

    public ParseResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
