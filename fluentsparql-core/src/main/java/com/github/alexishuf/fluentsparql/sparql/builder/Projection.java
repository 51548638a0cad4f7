package com.github.alexishuf.fluentsparql.sparql.builder;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An item of a {@code SELECT} clause: a plain variable or an expression bound to a
 * variable with {@code AS}.
 *
 * @param var the projected variable name, without {@code ?} or {@code $}
 * @param expression if non-null, the expression whose value is bound to {@code var}
 */
public record Projection(String var, @Nullable String expression) {
    public static Projection of(String var) { return new Projection(var, null); }

    public boolean isBound() { return expression != null; }

    public String sparql() {
        return expression == null ? "?"+var : "("+expression+" AS ?"+var+")";
    }

    @Override public String toString() { return sparql(); }
}
