package com.calor.compiler.codegen;

/**
 * Line-oriented output buffer. Every line states its own indent depth; the writer keeps
 * no current-indent state.
 *
 * Text passed to {@link #line(int, String)} may span several lines. Only the first gets the
 * depth prefix, the rest are written as given, which lets callers splice in pre-indented
 * nested blocks.
 */
public class CodeWriter {

    private final String indentUnit;
    private final StringBuilder out = new StringBuilder();
    private boolean lastBlank = true;

    public CodeWriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public CodeWriter line(int depth, String text) {
        out.append(indent(depth)).append(text).append('\n');
        lastBlank = false;
        return this;
    }

    /**
     * Blank separator line. Repeated calls, or a call at the very start, write nothing.
     */
    public CodeWriter blank() {
        if (!lastBlank) {
            out.append('\n');
            lastBlank = true;
        }
        return this;
    }

    public String indent(int depth) {
        return indentUnit.repeat(Math.max(depth, 0));
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    public boolean isEmpty() {
        return out.length() == 0;
    }

    /**
     * Written text without the final newline.
     */
    public String render() {
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '\n') {
            end--;
        }
        return out.substring(0, end);
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
