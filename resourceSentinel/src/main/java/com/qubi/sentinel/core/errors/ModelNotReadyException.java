package com.qubi.sentinel.core.errors;

/** Todavía no hay modelo entrenado: tratar como "historia insuficiente", no como crash. */
public class ModelNotReadyException extends SentinelException {
    public ModelNotReadyException() {
        super("no model has been trained yet");
    }
}
