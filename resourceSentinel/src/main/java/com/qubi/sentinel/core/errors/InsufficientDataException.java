package com.qubi.sentinel.core.errors;

/**
 * El entrenamiento no pudo completarse (historia insuficiente o presupuesto agotado).
 * El artefacto activo, si hay, sigue vigente.
 */
public class InsufficientDataException extends SentinelException {
    public InsufficientDataException(String message) { super(message); }

    public InsufficientDataException(long available, long required) {
        super("need at least " + required + " samples to train, have " + available);
    }
}
