package com.calor.compiler.model.expr;

/**
 * Optional comparison suffix on string intrinsics, e.g. {@code (contains s x :ignore-case)}.
 */
public enum ComparisonMode {
    ORDINAL("ordinal", "StringComparison.Ordinal"),
    IGNORE_CASE("ignore-case", "StringComparison.OrdinalIgnoreCase"),
    INVARIANT("invariant", "StringComparison.InvariantCulture"),
    INVARIANT_IGNORE_CASE("invariant-ignore-case", "StringComparison.InvariantCultureIgnoreCase");

    private final String keyword;
    private final String hostConstant;

    ComparisonMode(String keyword, String hostConstant) {
        this.keyword = keyword;
        this.hostConstant = hostConstant;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getHostConstant() {
        return hostConstant;
    }

    public static ComparisonMode fromKeyword(String keyword) {
        for (ComparisonMode mode : values()) {
            if (mode.keyword.equals(keyword)) {
                return mode;
            }
        }
        return null;
    }
}
