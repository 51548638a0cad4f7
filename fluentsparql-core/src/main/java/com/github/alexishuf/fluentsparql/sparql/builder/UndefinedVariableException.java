package com.github.alexishuf.fluentsparql.sparql.builder;

import java.util.List;

public class UndefinedVariableException extends UndefinedNameException {
    public UndefinedVariableException(List<String> variables) {
        super("The variables ?"+String.join(", ?", variables)+" don't occur in this query",
              variables);
    }
}
