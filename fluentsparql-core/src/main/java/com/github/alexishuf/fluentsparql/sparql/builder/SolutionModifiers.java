package com.github.alexishuf.fluentsparql.sparql.builder;

import com.github.alexishuf.fluentsparql.exceptions.FSInvalidArgument;
import com.github.alexishuf.fluentsparql.sparql.expr.ExpressionCategory;
import com.github.alexishuf.fluentsparql.sparql.expr.ExpressionClassifier;
import com.github.alexishuf.fluentsparql.sparql.expr.InvalidExpressionException;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.common.returnsreceiver.qual.This;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.github.alexishuf.fluentsparql.sparql.expr.ExpressionCategory.FUNCTION;
import static com.github.alexishuf.fluentsparql.sparql.expr.ExpressionCategory.VARIABLE;

/**
 * Solution modifiers that follow the {@code WHERE} group of a {@code SELECT}.
 *
 * <p>Each modifier holds at most one value: setting it again replaces the previous one.
 * Names mentioned by a replaced value remain in {@link #referencedVariables()} and
 * {@link #referencedPrefixes()}.</p>
 */
public class SolutionModifiers {
    private static final Set<ExpressionCategory> VAR_OR_FUNCTION = EnumSet.of(VARIABLE, FUNCTION);

    private final ExpressionClassifier classifier = new ExpressionClassifier();
    private @Nullable String groupBy, having, orderBy;
    private int limit = -1, offset = -1;

    /** Sets {@code GROUP BY expression}. */
    public @This SolutionModifiers groupBy(String expression) {
        classifier.classify(expression, VAR_OR_FUNCTION);
        groupBy = expression;
        return this;
    }

    /** Sets {@code HAVING (expression)}. */
    public @This SolutionModifiers having(String expression) {
        classifier.classify(expression, EnumSet.of(FUNCTION));
        having = '('+expression+')';
        return this;
    }

    /** Equivalent to {@link #orderBy(String, OrderDirection)} with {@link OrderDirection#ASC}. */
    public @This SolutionModifiers orderBy(String expression) {
        return orderBy(expression, OrderDirection.ASC);
    }

    /**
     * Sets {@code ORDER BY ASC(expression)} or {@code ORDER BY DESC(expression)}.
     *
     * @throws InvalidExpressionException if {@code expression} is neither a variable nor an
     *                                    expression
     * @throws FSInvalidArgument if {@code direction} is null
     */
    public @This SolutionModifiers orderBy(String expression, OrderDirection direction) {
        if (direction == null)
            throw new FSInvalidArgument("null ORDER BY direction");
        classifier.classify(expression, VAR_OR_FUNCTION);
        orderBy = direction.sparql(expression);
        return this;
    }

    /** Sets {@code LIMIT limit}. */
    public @This SolutionModifiers limit(@NonNegative int limit) {
        this.limit = requireNonNegative("LIMIT", limit);
        return this;
    }

    /** Sets {@code OFFSET offset}. */
    public @This SolutionModifiers offset(@NonNegative int offset) {
        this.offset = requireNonNegative("OFFSET", offset);
        return this;
    }

    private static int requireNonNegative(String clause, int value) {
        if (value < 0)
            throw new FSInvalidArgument(clause+" must be non-negative, got "+value);
        return value;
    }

    /** Variables mentioned by any modifier set so far. */
    public List<String> referencedVariables() { return classifier.variables(); }

    /** Prefixes mentioned by any modifier set so far. */
    public List<String> referencedPrefixes() { return classifier.prefixes(); }

    /** Renders the set modifiers, each preceded by a space, or the empty string. */
    public String sparql() {
        var sb = new StringBuilder();
        if (groupBy != null) sb.append(" GROUP BY ").append(groupBy);
        if (having  != null) sb.append(" HAVING ").append(having);
        if (orderBy != null) sb.append(" ORDER BY ").append(orderBy);
        if (limit   >= 0)    sb.append(" LIMIT ").append(limit);
        if (offset  >= 0)    sb.append(" OFFSET ").append(offset);
        return sb.toString();
    }

    @Override public String toString() { return sparql(); }
}
