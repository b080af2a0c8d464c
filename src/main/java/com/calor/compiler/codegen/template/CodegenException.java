package com.calor.compiler.codegen.template;

/**
 * Raised when a compilation-unit template cannot be loaded or rendered.
 */
public class CodegenException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CodegenException(String message, Throwable cause) {
        super(message, cause);
    }
}
