package com.houjicha.ast;

/**
 * Nodes that may appear inside a {@link Namespace}. Namespaces do not nest.
 */
public sealed interface NamespaceChild extends Node permits Claim, Comment {
}
