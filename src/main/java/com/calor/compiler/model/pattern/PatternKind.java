package com.calor.compiler.model.pattern;

public enum PatternKind {
    WILDCARD,
    LITERAL,
    VARIABLE,
    RELATIONAL,
    OPTION_RESULT,
    PROPERTY,
    POSITIONAL,
    LIST
}
