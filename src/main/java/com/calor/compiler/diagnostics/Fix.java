package com.calor.compiler.diagnostics;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Machine-applicable correction attached to a diagnostic.
 */
@Value
@Builder
public class Fix {

    @NonNull
    String description;

    @Singular
    List<TextEdit> edits;
}
