package com.houjicha.ast;

public enum LogicalOperator {
    AND("and"),
    OR("or");

    private final String label;

    LogicalOperator(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
