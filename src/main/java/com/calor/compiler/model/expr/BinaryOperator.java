package com.calor.compiler.model.expr;

import java.util.HashMap;
import java.util.Map;

/**
 * Binary operators of the Lisp expression syntax. The symbol is the canonical spelling;
 * word aliases are accepted on input only.
 */
public enum BinaryOperator {
    ADD("+", "+", Category.ARITHMETIC),
    SUBTRACT("-", "-", Category.ARITHMETIC),
    MULTIPLY("*", "*", Category.ARITHMETIC),
    DIVIDE("/", "/", Category.ARITHMETIC),
    MODULO("%", "%", Category.ARITHMETIC, "mod"),
    POWER("**", null, Category.ARITHMETIC),
    EQUAL("==", "==", Category.COMPARISON, "eq"),
    NOT_EQUAL("!=", "!=", Category.COMPARISON, "ne", "neq"),
    LESS("<", "<", Category.COMPARISON, "lt"),
    LESS_OR_EQUAL("<=", "<=", Category.COMPARISON, "le", "lte"),
    GREATER(">", ">", Category.COMPARISON, "gt"),
    GREATER_OR_EQUAL(">=", ">=", Category.COMPARISON, "ge", "gte"),
    AND("&&", "&&", Category.LOGICAL, "and"),
    OR("||", "||", Category.LOGICAL, "or"),
    BIT_AND("&", "&", Category.BITWISE),
    BIT_OR("|", "|", Category.BITWISE),
    BIT_XOR("^", "^", Category.BITWISE),
    SHIFT_LEFT("<<", "<<", Category.BITWISE),
    SHIFT_RIGHT(">>", ">>", Category.BITWISE);

    public enum Category {
        ARITHMETIC,
        COMPARISON,
        LOGICAL,
        BITWISE
    }

    private static final Map<String, BinaryOperator> BY_SPELLING = new HashMap<>();

    static {
        for (BinaryOperator op : values()) {
            BY_SPELLING.put(op.symbol, op);
            for (String alias : op.aliases) {
                BY_SPELLING.put(alias, op);
            }
        }
    }

    private final String symbol;
    private final String hostSymbol;
    private final Category category;
    private final String[] aliases;

    BinaryOperator(String symbol, String hostSymbol, Category category, String... aliases) {
        this.symbol = symbol;
        this.hostSymbol = hostSymbol;
        this.category = category;
        this.aliases = aliases;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Infix operator in the host language, or null when it lowers to a call.
     */
    public String getHostSymbol() {
        return hostSymbol;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isArithmetic() {
        return category == Category.ARITHMETIC;
    }

    public boolean isComparison() {
        return category == Category.COMPARISON;
    }

    public boolean isLogical() {
        return category == Category.LOGICAL;
    }

    public static BinaryOperator fromSpelling(String spelling) {
        return BY_SPELLING.get(spelling);
    }

    public static java.util.Set<String> spellings() {
        return BY_SPELLING.keySet();
    }
}
