package com.calor.compiler.model;

import java.util.Locale;

/**
 * Declared member visibility with its Calor shorthand and host-language keyword.
 */
public enum Visibility {
    PUBLIC("pub", "public"),
    PRIVATE("pri", "private"),
    PROTECTED("pro", "protected"),
    INTERNAL("int", "internal");

    private final String shorthand;
    private final String keyword;

    Visibility(String shorthand, String keyword) {
        this.shorthand = shorthand;
        this.keyword = keyword;
    }

    public String getShorthand() {
        return shorthand;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Resolves either the shorthand ({@code pub}) or the full keyword ({@code public}).
     * Returns null when the text is not a visibility.
     */
    public static Visibility fromText(String text) {
        if (text == null) {
            return null;
        }
        String lower = text.trim().toLowerCase(Locale.ROOT);
        for (Visibility v : values()) {
            if (v.shorthand.equals(lower) || v.keyword.equals(lower)) {
                return v;
            }
        }
        return null;
    }

    public static Visibility fromTextOrDefault(String text, Visibility fallback) {
        Visibility v = fromText(text);
        return v != null ? v : fallback;
    }
}
