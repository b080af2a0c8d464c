package com.calor.compiler.model.expr;

import java.util.HashMap;
import java.util.Map;

public enum UnaryOperator {
    NOT("!", "not"),
    NEGATE("-", null),
    BITWISE_NOT("~", null),
    INCREMENT("inc", null),
    DECREMENT("dec", null),
    POST_INCREMENT("post-inc", null),
    POST_DECREMENT("post-dec", null);

    private static final Map<String, UnaryOperator> BY_SPELLING = new HashMap<>();

    static {
        for (UnaryOperator op : values()) {
            BY_SPELLING.put(op.symbol, op);
            if (op.alias != null) {
                BY_SPELLING.put(op.alias, op);
            }
        }
    }

    private final String symbol;
    private final String alias;

    UnaryOperator(String symbol, String alias) {
        this.symbol = symbol;
        this.alias = alias;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * True for the increment/decrement family, which mutate their operand.
     */
    public boolean isMutating() {
        return this == INCREMENT || this == DECREMENT || this == POST_INCREMENT || this == POST_DECREMENT;
    }

    public static UnaryOperator fromSpelling(String spelling) {
        return BY_SPELLING.get(spelling);
    }

    public static java.util.Set<String> spellings() {
        return BY_SPELLING.keySet();
    }
}
