package com.calor.compiler.parser;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.Value;

/**
 * The {@code {a:b:c}} (or {@code [a:b:c]}) block written directly after a tag.
 */
@Value
public class AttributeBlock {

    public static final AttributeBlock NONE = new AttributeBlock(List.of(), Span.EMPTY, false);

    List<AttributePart> parts;

    /** Span of the whole block including the delimiters. */
    Span span;

    boolean present;

    /**
     * Positional value at {@code index}, or null when absent or blank.
     */
    public String get(int index) {
        if (index < 0 || index >= parts.size()) {
            return null;
        }
        String text = parts.get(index).getText().trim();
        return text.isEmpty() ? null : text;
    }

    public String getOrDefault(int index, String fallback) {
        String value = get(index);
        return value != null ? value : fallback;
    }

    public AttributePart part(int index) {
        return index >= 0 && index < parts.size() ? parts.get(index) : null;
    }

    public int size() {
        return parts.size();
    }
}
