package com.calor.compiler.model.decl;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class UnionTypeDeclaration implements Declaration {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    List<UnionCase> cases;

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.UNION;
    }
}
