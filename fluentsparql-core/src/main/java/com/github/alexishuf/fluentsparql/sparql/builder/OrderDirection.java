package com.github.alexishuf.fluentsparql.sparql.builder;

public enum OrderDirection {
    ASC,
    DESC;

    /** Renders {@code expression} as an {@code ORDER BY} condition in this direction. */
    public String sparql(String expression) {
        return name()+'('+expression+')';
    }
}
