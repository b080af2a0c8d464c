package com.calor.compiler.model.decl;

import java.util.List;

import com.calor.compiler.model.Visibility;
import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class PropertyDeclaration implements Declaration {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    String type;

    @NonNull
    Visibility visibility;

    @NonNull
    List<PropertyAccessor> accessors;

    Expression defaultValue;

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.PROPERTY;
    }
}
