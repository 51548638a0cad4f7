package com.github.alexishuf.fluentsparql.sparql.builder;

public class SelfSubqueryException extends InvalidSubqueryException {
    public SelfSubqueryException() {
        super("Cannot add a query as subquery of itself");
    }
}
