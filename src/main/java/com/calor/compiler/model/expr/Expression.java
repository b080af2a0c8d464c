package com.calor.compiler.model.expr;

import com.calor.compiler.model.Node;

/**
 * Closed family of expression nodes. Passes switch over {@link #kind()}.
 */
public sealed interface Expression extends Node
        permits LiteralExpression, ReferenceExpression, BinaryExpression, UnaryExpression,
        CallExpression, NewExpression, FieldAccessExpression, ConditionalExpression,
        MatchExpression, AwaitExpression, LambdaExpression, StringOpExpression,
        CharOpExpression, BuilderOpExpression, OptionResultExpression, CastExpression,
        UncheckedExpression, UnwrapExpression {

    ExpressionKind kind();
}
