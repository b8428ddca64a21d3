package com.houjicha.ast;

/**
 * Nodes that may appear directly under a {@link Document}.
 */
public sealed interface DocumentChild extends Node permits Namespace, Claim, Comment {
}
