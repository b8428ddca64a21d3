package com.houjicha.ast;

/**
 * Base interface for all houjicha AST nodes
 */
public sealed interface Node permits
    Document,
    DocumentChild,
    NamespaceChild,
    Reference,
    Fact,
    Evaluation,
    Requirement,
    Norm,
    Issue,
    Reason,
    Conclusion,
    Effect,
    ReasonStatement,
    ConstantDefinition {

    String type();
    Range range();
}
