package com.opensiddur.conditions;

/**
 * Three-valued result of a condition. UNDEFINED is a value in its own right and is
 * never collapsed to TRUE or FALSE by the combinators.
 */
public enum Truth {
    TRUE,
    FALSE,
    UNDEFINED;

    public static Truth of(boolean value) {
        return value ? TRUE : FALSE;
    }
}
