package com.qubi.sentinel.core.errors;

import java.time.Instant;

/** Timestamp anterior al último almacenado. El collector nunca hace backfill. */
public class OrderingException extends SentinelException {
    private final Instant rejected;
    private final Instant last;

    public OrderingException(Instant rejected, Instant last) {
        super("sample at " + rejected + " is older than last stored sample at " + last);
        this.rejected = rejected;
        this.last = last;
    }

    public Instant rejected() { return rejected; }
    public Instant last() { return last; }
}
