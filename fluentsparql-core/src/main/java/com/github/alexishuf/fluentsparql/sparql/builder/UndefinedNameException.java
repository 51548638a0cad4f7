package com.github.alexishuf.fluentsparql.sparql.builder;

import com.github.alexishuf.fluentsparql.sparql.InvalidSparqlException;

import java.util.List;

/**
 * A query uses names that are not declared (prefixes) or bound (variables) anywhere in
 * the query. Detected only when the query is rendered.
 */
public abstract class UndefinedNameException extends InvalidSparqlException {
    private final List<String> names;

    protected UndefinedNameException(String message, List<String> names) {
        super(message);
        this.names = List.copyOf(names);
    }

    /** Every offending name, in first-use order. */
    public List<String> names() { return names; }
}
