package com.calor.compiler.model.expr;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * String intrinsics with their accepted operand counts.
 */
public enum StringOp {
    LENGTH("len", 1, 1, false),
    CONTAINS("contains", 2, 2, true),
    STARTS_WITH("starts", 2, 2, true),
    ENDS_WITH("ends", 2, 2, true),
    INDEX_OF("indexof", 2, 2, true),
    EQUALS("equals", 2, 2, true),
    IS_EMPTY("isempty", 1, 1, false),
    IS_BLANK("isblank", 1, 1, false),
    SUBSTRING("substr", 2, 3, false),
    REPLACE("replace", 3, 3, false),
    UPPER("upper", 1, 1, false),
    LOWER("lower", 1, 1, false),
    TRIM("trim", 1, 1, false),
    TRIM_START("ltrim", 1, 1, false),
    TRIM_END("rtrim", 1, 1, false),
    PAD_LEFT("lpad", 2, 3, false),
    PAD_RIGHT("rpad", 2, 3, false),
    JOIN("join", 2, 2, false),
    FORMAT("fmt", 1, Integer.MAX_VALUE, false),
    CONCAT("concat", 1, Integer.MAX_VALUE, false),
    SPLIT("split", 2, 2, false),
    TO_STRING("str", 1, 1, false),
    REGEX_TEST("regex-test", 2, 2, false),
    REGEX_REPLACE("regex-replace", 3, 3, false);

    private static final Map<String, StringOp> BY_NAME = new LinkedHashMap<>();

    static {
        for (StringOp op : values()) {
            BY_NAME.put(op.name, op);
        }
    }

    private final String name;
    private final int minArgs;
    private final int maxArgs;
    private final boolean comparisonModeSupported;

    StringOp(String name, int minArgs, int maxArgs, boolean comparisonModeSupported) {
        this.name = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.comparisonModeSupported = comparisonModeSupported;
    }

    public String getName() {
        return name;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public int getMaxArgs() {
        return maxArgs;
    }

    public boolean isComparisonModeSupported() {
        return comparisonModeSupported;
    }

    public static StringOp fromName(String name) {
        return BY_NAME.get(name);
    }

    public static java.util.Set<String> names() {
        return BY_NAME.keySet();
    }
}
