package com.calor.compiler.model.decl;

import com.calor.compiler.model.Visibility;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class EventDeclaration implements Declaration {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    Visibility visibility;

    @NonNull
    String delegateType;

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.EVENT;
    }
}
