package com.calor.compiler.model.expr;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * String builder intrinsics.
 */
public enum BuilderOp {
    NEW("sb-new", 0, 1),
    APPEND("sb-append", 2, 2),
    APPEND_LINE("sb-appendline", 1, 2),
    INSERT("sb-insert", 3, 3),
    REMOVE("sb-remove", 3, 3),
    CLEAR("sb-clear", 1, 1),
    TO_STRING("sb-tostring", 1, 1),
    LENGTH("sb-length", 1, 1);

    private static final Map<String, BuilderOp> BY_NAME = new LinkedHashMap<>();

    static {
        for (BuilderOp op : values()) {
            BY_NAME.put(op.name, op);
        }
    }

    private final String name;
    private final int minArgs;
    private final int maxArgs;

    BuilderOp(String name, int minArgs, int maxArgs) {
        this.name = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
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

    public static BuilderOp fromName(String name) {
        return BY_NAME.get(name);
    }

    public static java.util.Set<String> names() {
        return BY_NAME.keySet();
    }
}
