package com.qubi.sentinel.core.spi;

import com.qubi.sentinel.core.model.ModelArtifact;

import java.io.IOException;
import java.util.Optional;

public interface ArtifactRepository {

    /** Persiste una versión nueva. Nunca sobreescribe una versión existente. */
    void save(ModelArtifact artifact) throws IOException;

    Optional<ModelArtifact> latest() throws IOException;

    Optional<ModelArtifact> load(long version) throws IOException;

    /** 0 si todavía no hay artefactos. */
    long latestVersion() throws IOException;
}
