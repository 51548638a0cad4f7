package com.github.alexishuf.fluentsparql.sparql.builder;

import java.util.List;

public class UndefinedPrefixException extends UndefinedNameException {
    public UndefinedPrefixException(List<String> prefixes) {
        super("The prefixes "+String.join(", ", prefixes)+" aren't defined for this query",
              prefixes);
    }
}
