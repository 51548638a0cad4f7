package com.github.alexishuf.fluentsparql.exceptions;

public class FSIllegalStateException extends FSException {
    public FSIllegalStateException(String message) {
        super(message);
    }
}
