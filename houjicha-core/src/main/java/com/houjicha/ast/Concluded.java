package com.houjicha.ast;

/**
 * Conclusion marker on claims, requirements and norms: {@code +} is positive,
 * {@code !} is negative, no marker leaves the element undecided.
 */
public enum Concluded {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NONE("none");

    private final String label;

    Concluded(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
