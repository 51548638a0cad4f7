package com.github.alexishuf.fluentsparql.sparql.expr;

import com.github.alexishuf.fluentsparql.sparql.InvalidSparqlException;

/** A token given to a builder is not a text that can be classified. */
public class InvalidExpressionException extends InvalidSparqlException {
    public InvalidExpressionException(String message) {
        super(message);
    }
}
