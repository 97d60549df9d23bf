package com.qubi.sentinel.core.errors;

import java.util.List;

public class SchemaMismatchException extends SentinelException {
    private final List<String> expected;
    private final List<String> actual;

    public SchemaMismatchException(List<String> expected, List<String> actual) {
        super("sample features " + actual + " do not match model schema " + expected);
        this.expected = List.copyOf(expected);
        this.actual = List.copyOf(actual);
    }

    public List<String> expected() { return expected; }
    public List<String> actual() { return actual; }
}
