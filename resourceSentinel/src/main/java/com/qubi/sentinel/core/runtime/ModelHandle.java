package com.qubi.sentinel.core.runtime;

import com.qubi.sentinel.core.model.ModelArtifact;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Referencia al artefacto activo. Se reemplaza atómicamente y sólo por una versión más
 * nueva; los lectores siempre ven un artefacto completo.
 */
public final class ModelHandle {
    private final AtomicReference<ModelArtifact> current = new AtomicReference<>();

    public ModelHandle() {}

    public ModelHandle(ModelArtifact initial) {
        current.set(initial);
    }

    public Optional<ModelArtifact> current() {
        return Optional.ofNullable(current.get());
    }

    /** @return true si {@code artifact} quedó activo */
    public boolean publish(ModelArtifact artifact) {
        ModelArtifact prev = current.getAndUpdate(
                cur -> cur == null || artifact.version() > cur.version() ? artifact : cur);
        return prev == null || artifact.version() > prev.version();
    }
}
