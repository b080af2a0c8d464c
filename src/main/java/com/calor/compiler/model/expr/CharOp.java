package com.calor.compiler.model.expr;

import java.util.LinkedHashMap;
import java.util.Map;

public enum CharOp {
    CHAR_AT("char-at", 2),
    CHAR_CODE("char-code", 1),
    CHAR_FROM_CODE("char-from-code", 1),
    IS_LETTER("is-letter", 1),
    IS_DIGIT("is-digit", 1),
    IS_WHITESPACE("is-whitespace", 1),
    IS_UPPER("is-upper", 1),
    IS_LOWER("is-lower", 1),
    TO_UPPER("char-upper", 1),
    TO_LOWER("char-lower", 1);

    private static final Map<String, CharOp> BY_NAME = new LinkedHashMap<>();

    static {
        for (CharOp op : values()) {
            BY_NAME.put(op.name, op);
        }
    }

    private final String name;
    private final int arity;

    CharOp(String name, int arity) {
        this.name = name;
        this.arity = arity;
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    public boolean isPredicate() {
        return name.startsWith("is-");
    }

    public static CharOp fromName(String name) {
        return BY_NAME.get(name);
    }

    public static java.util.Set<String> names() {
        return BY_NAME.keySet();
    }
}
