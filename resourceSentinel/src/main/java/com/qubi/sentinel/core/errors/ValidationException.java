package com.qubi.sentinel.core.errors;

/** Muestra con un valor fuera de [0,100] o no finito. */
public class ValidationException extends SentinelException {
    private final String field;
    private final double value;

    public ValidationException(String field, double value) {
        super("invalid " + field + ": " + value + " (expected a finite value in [0,100])");
        this.field = field;
        this.value = value;
    }

    public String field() { return field; }
    public double value() { return value; }
}
