package com.calor.compiler.model.decl;

import java.util.List;

import com.calor.compiler.model.EffectSet;
import com.calor.compiler.model.Parameter;
import com.calor.compiler.model.Visibility;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class DelegateDeclaration implements Declaration {

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
    List<Parameter> parameters;

    String returnType;

    @NonNull
    EffectSet effects;

    @Override
    public DeclarationKind kind() {
        return DeclarationKind.DELEGATE;
    }
}
