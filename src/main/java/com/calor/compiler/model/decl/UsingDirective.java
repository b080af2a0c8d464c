package com.calor.compiler.model.decl;

import com.calor.compiler.model.Node;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §U{ns}}, {@code §U{alias:ns}} or {@code §U{static:ns}}.
 */
@Value
public class UsingDirective implements Node {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String namespace;

    String alias;

    boolean staticImport;
}
