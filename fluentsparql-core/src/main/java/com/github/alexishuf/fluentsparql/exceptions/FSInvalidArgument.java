package com.github.alexishuf.fluentsparql.exceptions;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A value given to a builder method is outside its domain, such as a negative
 * {@code LIMIT} or a malformed prefix mapping.
 */
public class FSInvalidArgument extends FSException {
    public FSInvalidArgument(String message) {
        super(message);
    }

    public FSInvalidArgument(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
