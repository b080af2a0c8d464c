package com.calor.compiler.model.pattern;

public enum RelationalOperator {
    GTE("gte", ">="),
    LTE("lte", "<="),
    GT("gt", ">"),
    LT("lt", "<");

    private final String keyword;
    private final String hostSymbol;

    RelationalOperator(String keyword, String hostSymbol) {
        this.keyword = keyword;
        this.hostSymbol = hostSymbol;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getHostSymbol() {
        return hostSymbol;
    }

    public static RelationalOperator fromKeyword(String keyword) {
        for (RelationalOperator op : values()) {
            if (op.keyword.equals(keyword)) {
                return op;
            }
        }
        return null;
    }
}
