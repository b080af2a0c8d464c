package com.calor.compiler.diagnostics;

import com.calor.compiler.model.Span;

import lombok.NonNull;
import lombok.Value;

/**
 * Replacement of the text between two 1-based positions; the end position is exclusive.
 */
@Value
public class TextEdit {

    int startLine;
    int startColumn;
    int endLine;
    int endColumn;

    @NonNull
    String newText;

    public static TextEdit replace(Span span, String newText) {
        return new TextEdit(span.getLine(), span.getColumn(), span.getEndLine(), span.getEndColumn(), newText);
    }

    public static TextEdit insert(int line, int column, String newText) {
        return new TextEdit(line, column, line, column, newText);
    }
}
