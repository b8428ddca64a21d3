package com.houjicha.ast;

/**
 * A point in the source text. Line and column are zero-based; offset is the
 * absolute character index.
 */
public record Position(int line, int column, int offset) {
}
