package com.calor.compiler.model.expr;

/**
 * Constructors of the Option and Result sum types.
 */
public enum OptionResultVariant {
    SOME("SM"),
    NONE("NN"),
    OK("OK"),
    ERR("ERR");

    private final String tag;

    OptionResultVariant(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public boolean isOption() {
        return this == SOME || this == NONE;
    }
}
