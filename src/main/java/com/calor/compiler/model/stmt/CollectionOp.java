package com.calor.compiler.model.stmt;

/**
 * In-place collection mutations with the number of operands after the collection name.
 */
public enum CollectionOp {
    PUSH("PUSH", 1),
    PUT("PUT", 2),
    REMOVE("REM", 1),
    SET_INDEX("SETIDX", 2),
    CLEAR("CLR", 0),
    INSERT("INS", 2);

    private final String tag;
    private final int arity;

    CollectionOp(String tag, int arity) {
        this.tag = tag;
        this.arity = arity;
    }

    public String getTag() {
        return tag;
    }

    public int getArity() {
        return arity;
    }
}
