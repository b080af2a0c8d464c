package com.calor.compiler.semantic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.prover.ContractProposition;

/**
 * Facts recorded by the checker for later stages. Expression types are keyed by node
 * identity, since structurally equal nodes at different places may type differently.
 */
public class SemanticModel {

    public static final SemanticModel EMPTY = new SemanticModel(new IdentityHashMap<>(), List.of());

    private final Map<Expression, CalorType> expressionTypes;
    private final List<ContractProposition> propositions;

    public SemanticModel(Map<Expression, CalorType> expressionTypes, List<ContractProposition> propositions) {
        this.expressionTypes = expressionTypes;
        this.propositions = Collections.unmodifiableList(new ArrayList<>(propositions));
    }

    /**
     * Type recorded for {@code expression}, or UNKNOWN when the checker never saw it.
     */
    public CalorType typeOf(Expression expression) {
        CalorType type = expressionTypes.get(expression);
        return type != null ? type : CalorType.UNKNOWN;
    }

    public boolean hasType(Expression expression) {
        return expressionTypes.containsKey(expression);
    }

    public List<ContractProposition> getPropositions() {
        return propositions;
    }

    public int size() {
        return expressionTypes.size();
    }
}
