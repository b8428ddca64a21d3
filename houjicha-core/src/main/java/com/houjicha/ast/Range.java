package com.houjicha.ast;

/**
 * Source extent of a token or node. The end is exclusive.
 */
public record Range(Position start, Position end) {

    public static Range of(Position start, Position end) {
        return new Range(start, end);
    }

    public static Range at(Position position) {
        return new Range(position, position);
    }
}
