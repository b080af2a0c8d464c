package com.calor.compiler.model;

/**
 * Which surface form a conditional, loop or match case was written in.
 */
public enum BodyForm {
    /** {@code → stmt} on the same line. */
    ARROW,
    /** One or more statements up to the closing tag. */
    BLOCK
}
