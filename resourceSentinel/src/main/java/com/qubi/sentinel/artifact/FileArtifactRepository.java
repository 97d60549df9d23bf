package com.qubi.sentinel.artifact;

import com.qubi.sentinel.core.model.JsonSupport;
import com.qubi.sentinel.core.model.ModelArtifact;
import com.qubi.sentinel.core.spi.ArtifactRepository;
import com.qubi.sentinel.ml.IsolationTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Un archivo JSON por versión ({@code model-000042.json}). Se escribe a un temporal y se
 * mueve atómicamente, así que un lector nunca encuentra un artefacto a medio escribir.
 */
public class FileArtifactRepository implements ArtifactRepository {
    private static final Logger log = LoggerFactory.getLogger(FileArtifactRepository.class);

    private static final Pattern FILE = Pattern.compile("model-(\\d+)\\.json");

    private final Path dir;

    public FileArtifactRepository(Path dir) {
        this.dir = dir;
    }

    static String fileName(long version) {
        return String.format(Locale.ROOT, "model-%06d.json", version);
    }

    @Override
    public void save(ModelArtifact artifact) throws IOException {
        Files.createDirectories(dir);
        Path target = dir.resolve(fileName(artifact.version()));
        if (Files.exists(target))
            throw new FileAlreadyExistsException(target.toString(), null, "model version already persisted");

        Path tmp = Files.createTempFile(dir, ".model-" + artifact.version() + "-", ".tmp");
        try {
            Files.write(tmp, JsonSupport.toBytes(artifact));
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("[save] model v{} -> {}", artifact.version(), target);
    }

    @Override
    public Optional<ModelArtifact> latest() throws IOException {
        OptionalLong v = highestVersion();
        return v.isPresent() ? load(v.getAsLong()) : Optional.empty();
    }

    @Override
    public Optional<ModelArtifact> load(long version) throws IOException {
        Path file = dir.resolve(fileName(version));
        if (!Files.exists(file)) return Optional.empty();
        ModelArtifact a;
        try (InputStream in = Files.newInputStream(file)) {
            a = JsonSupport.read(in, ModelArtifact.class);
        }
        checkLoadable(a, file);
        return Optional.of(a);
    }

    @Override
    public long latestVersion() throws IOException {
        return highestVersion().orElse(0L);
    }

    private OptionalLong highestVersion() throws IOException {
        if (!Files.isDirectory(dir)) return OptionalLong.empty();
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> FILE.matcher(p.getFileName().toString()))
                    .filter(Matcher::matches)
                    .mapToLong(m -> Long.parseLong(m.group(1)))
                    .max();
        }
    }

    // Un artefacto incompatible se rechaza en vez de reinterpretar sus campos
    private static void checkLoadable(ModelArtifact a, Path file) throws IOException {
        if (a.formatVersion() != ModelArtifact.FORMAT_VERSION)
            throw new IOException("unsupported model format " + a.formatVersion() + " in " + file
                    + " (supported: " + ModelArtifact.FORMAT_VERSION + ")");
        int dims = a.featureSchema().size();
        if (dims == 0 || a.scaler().mean().length != dims || a.scaler().std().length != dims)
            throw new IOException("scaler does not match feature schema " + a.featureSchema() + " in " + file);
        if (a.trees().isEmpty())
            throw new IOException("model without trees in " + file);
        for (IsolationTree t : a.trees()) checkTree(t, dims, file);
    }

    // Los hijos siempre tienen índice mayor que el padre; eso garantiza que pathLength termina
    private static void checkTree(IsolationTree t, int dims, Path file) throws IOException {
        int[] feature = t.feature();
        int[] left = t.left();
        int[] right = t.right();
        int[] size = t.size();
        int n = feature.length;
        if (n == 0 || t.split().length != n || left.length != n || right.length != n || size.length != n)
            throw new IOException("malformed tree in " + file);
        for (int i = 0; i < n; i++) {
            if (size[i] < 0) throw new IOException("negative node size at node " + i + " in " + file);
            if (feature[i] == -1) continue;
            if (feature[i] < 0 || feature[i] >= dims)
                throw new IOException("tree splits on unknown feature " + feature[i] + " in " + file);
            if (left[i] <= i || left[i] >= n || right[i] <= i || right[i] >= n)
                throw new IOException("invalid child index at node " + i + " in " + file);
        }
    }
}
