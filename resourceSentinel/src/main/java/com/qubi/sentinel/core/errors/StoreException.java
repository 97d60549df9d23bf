package com.qubi.sentinel.core.errors;

/**
 * Fallo de I/O o corrupción del store. Es la única condición fatal: se pierde la serie
 * de referencia.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) { super(message); }
    public StoreException(String message, Throwable cause) { super(message, cause); }
}
