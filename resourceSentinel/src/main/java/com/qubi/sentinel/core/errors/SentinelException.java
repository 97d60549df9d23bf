package com.qubi.sentinel.core.errors;

/**
 * Base de los errores recuperables del pipeline. Ninguno es fatal para el proceso:
 * el caller decide si descarta, reintenta o informa "sin datos suficientes".
 */
public abstract class SentinelException extends Exception {
    protected SentinelException(String message) { super(message); }
    protected SentinelException(String message, Throwable cause) { super(message, cause); }
}
