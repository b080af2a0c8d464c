package com.calor.compiler.model;

/**
 * Common supertype of every AST node. Spans never take part in node equality.
 */
public interface Node {

    Span getSpan();
}
