package com.github.alexishuf.fluentsparql.sparql.builder;

public class CyclicSubqueryException extends InvalidSubqueryException {
    public CyclicSubqueryException() {
        super("Cannot add a subquery that already contains this query");
    }
}
