package com.github.alexishuf.fluentsparql.sparql;

import com.github.alexishuf.fluentsparql.exceptions.FSException;

public class InvalidSparqlException extends FSException {
    public InvalidSparqlException(String message) {
        super(message);
    }
}
