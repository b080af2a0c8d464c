package com.calor.compiler.parser;

import com.calor.compiler.model.Span;

import lombok.Value;

/**
 * One colon-separated positional entry of an attribute block, with its exact source span.
 */
@Value
public class AttributePart {
    String text;
    Span span;
}
