package com.calor.compiler.model.pattern;

import com.calor.compiler.model.Node;

/**
 * Closed family of match patterns.
 */
public sealed interface Pattern extends Node
        permits WildcardPattern, LiteralPattern, VariablePattern, RelationalPattern,
        OptionResultPattern, PropertyPattern, PositionalPattern, ListPattern {

    PatternKind kind();

    /**
     * True when the pattern matches every value of the target type.
     */
    default boolean isIrrefutable() {
        return kind() == PatternKind.WILDCARD || kind() == PatternKind.VARIABLE;
    }
}
