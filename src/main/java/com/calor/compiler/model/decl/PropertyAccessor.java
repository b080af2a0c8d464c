package com.calor.compiler.model.decl;

import java.util.List;

import com.calor.compiler.model.Node;
import com.calor.compiler.model.Span;
import com.calor.compiler.model.Visibility;
import com.calor.compiler.model.stmt.Statement;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §GET}, {@code §SET} or {@code §INIT}; an empty body is an auto-accessor.
 */
@Value
public class PropertyAccessor implements Node {

    public enum Kind {
        GET,
        SET,
        INIT
    }

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    Kind accessorKind;

    /** Null when the accessor inherits the property visibility. */
    Visibility visibility;

    @NonNull
    List<Statement> body;
}
