package com.github.alexishuf.fluentsparql.sparql.builder;

import com.github.alexishuf.fluentsparql.sparql.InvalidSparqlException;

/** Attaching a subquery would make the subquery forest cyclic. */
public class InvalidSubqueryException extends InvalidSparqlException {
    public InvalidSubqueryException(String message) {
        super(message);
    }
}
