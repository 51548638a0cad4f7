package com.github.alexishuf.fluentsparql.sparql.expr;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A token does not belong to any {@link ExpressionCategory} accepted by a
 * {@link ExpressionClassifier#classify(CharSequence, Set)} call.
 */
public class UnmatchedExpressionException extends InvalidExpressionException {
    private final String expression;
    private final Set<ExpressionCategory> accepted;

    public UnmatchedExpressionException(CharSequence expression, Set<ExpressionCategory> accepted) {
        super("\""+escape(expression)+"\" is not any of "+accepted);
        this.expression = expression.toString();
        this.accepted = accepted.isEmpty() ? Collections.emptySet()
                      : Collections.unmodifiableSet(EnumSet.copyOf(accepted));
    }

    private static String escape(CharSequence expression) {
        return expression.toString().replace("\\", "\\\\").replace("\n", "\\n")
                         .replace("\r", "\\r").replace("\t", "\\t");
    }

    public String expression() { return expression; }

    /** The categories that were tried, in precedence order. */
    public Set<ExpressionCategory> accepted() { return accepted; }
}
