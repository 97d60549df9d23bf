package com.qubi.sentinel.artifact;

import com.qubi.sentinel.core.model.EnsembleParams;
import com.qubi.sentinel.core.model.MetricSample;
import com.qubi.sentinel.core.model.ModelArtifact;
import com.qubi.sentinel.core.model.ScalerParams;
import com.qubi.sentinel.ml.IsolationForest;
import com.qubi.sentinel.ml.IsolationTree;
import com.qubi.sentinel.ml.StandardScaler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class FileArtifactRepositoryTest {

    @TempDir
    Path dir;

    private static final double[][] RAW = rows();

    private static double[][] rows() {
        Random r = new Random(3);
        double[][] out = new double[64][];
        for (int i = 0; i < out.length; i++)
            out[i] = new double[] { 20 + r.nextGaussian(), 40 + r.nextGaussian(), 60 + r.nextGaussian() };
        return out;
    }

    private static ModelArtifact artifact(long version) {
        ScalerParams scaler = StandardScaler.fit(RAW);
        IsolationForest forest = IsolationForest.fit(StandardScaler.transform(scaler, RAW), 10, 32, 5, new Random(version));
        return new ModelArtifact(ModelArtifact.FORMAT_VERSION, version, Instant.parse("2026-01-01T00:00:00Z"),
                RAW.length, MetricSample.FEATURES, scaler, new EnsembleParams(10, 32, 5, version),
                0.05, 0.6, forest.trees());
    }

    @Test
    void emptyDirectory_hasNoArtifacts() throws Exception {
        FileArtifactRepository repo = new FileArtifactRepository(dir.resolve("missing"));
        assertEquals(0, repo.latestVersion());
        assertTrue(repo.latest().isEmpty());
        assertTrue(repo.load(1).isEmpty());
    }

    @Test
    void save_thenLatestReturnsHighestVersion() throws Exception {
        FileArtifactRepository repo = new FileArtifactRepository(dir.resolve("models"));
        repo.save(artifact(1));
        repo.save(artifact(2));

        assertEquals(2, repo.latestVersion());
        ModelArtifact latest = repo.latest().orElseThrow();
        assertEquals(2, latest.version());
        assertEquals(MetricSample.FEATURES, latest.featureSchema());
        assertTrue(Files.exists(dir.resolve("models").resolve("model-000002.json")));
        assertEquals(1, repo.load(1).orElseThrow().version());
    }

    @Test
    void save_neverOverwritesExistingVersion() throws Exception {
        FileArtifactRepository repo = new FileArtifactRepository(dir);
        repo.save(artifact(1));
        byte[] before = Files.readAllBytes(dir.resolve(FileArtifactRepository.fileName(1)));

        assertThrows(FileAlreadyExistsException.class, () -> repo.save(artifact(1)));
        assertArrayEquals(before, Files.readAllBytes(dir.resolve(FileArtifactRepository.fileName(1))));
    }

    @Test
    void save_leavesNoTemporaryFiles() throws Exception {
        FileArtifactRepository repo = new FileArtifactRepository(dir);
        repo.save(artifact(1));
        try (var files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void reloadedArtifact_scoresLikeTheOriginal() throws Exception {
        FileArtifactRepository repo = new FileArtifactRepository(dir);
        ModelArtifact original = artifact(1);
        repo.save(original);
        ModelArtifact loaded = repo.load(1).orElseThrow();

        assertEquals(original.trainedAt(), loaded.trainedAt());
        assertEquals(original.ensemble(), loaded.ensemble());
        assertEquals(original.scoreThreshold(), loaded.scoreThreshold());
        assertArrayEquals(original.scaler().mean(), loaded.scaler().mean());

        IsolationForest a = new IsolationForest(original.trees(), original.ensemble().subsampleSize());
        IsolationForest b = new IsolationForest(loaded.trees(), loaded.ensemble().subsampleSize());
        double[][] scaled = StandardScaler.transform(original.scaler(), RAW);
        assertArrayEquals(a.scoreAll(scaled), b.scoreAll(scaled));
    }

    @Test
    void unsupportedFormatVersion_isRejected() throws Exception {
        FileArtifactRepository repo = new FileArtifactRepository(dir);
        repo.save(artifact(1));
        Path file = dir.resolve(FileArtifactRepository.fileName(1));
        String json = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, json.replace("\"format_version\":1", "\"format_version\":99"), StandardCharsets.UTF_8);

        IOException e = assertThrows(IOException.class, () -> repo.load(1));
        assertTrue(e.getMessage().contains("99"), e.getMessage());
    }

    private static ModelArtifact withTree(IsolationTree tree) {
        ModelArtifact a = artifact(1);
        return new ModelArtifact(a.formatVersion(), a.version(), a.trainedAt(), a.trainingSamples(),
                a.featureSchema(), a.scaler(), a.ensemble(), a.contamination(), a.scoreThreshold(), List.of(tree));
    }

    @Test
    void selfReferencingTree_isRejected() throws Exception {
        FileArtifactRepository repo = new FileArtifactRepository(dir);
        repo.save(withTree(new IsolationTree(new int[] { 0, -1 }, new double[] { 0.0, 0.0 },
                new int[] { 0, -1 }, new int[] { 1, -1 }, new int[] { 2, 1 })));

        IOException e = assertThrows(IOException.class, () -> repo.load(1));
        assertTrue(e.getMessage().contains("child index"), e.getMessage());
    }

    @Test
    void childOutOfBounds_isRejected() throws Exception {
        FileArtifactRepository repo = new FileArtifactRepository(dir);
        repo.save(withTree(new IsolationTree(new int[] { 1, -1 }, new double[] { 0.0, 0.0 },
                new int[] { 1, -1 }, new int[] { 7, -1 }, new int[] { 2, 1 })));

        assertThrows(IOException.class, () -> repo.load(1));
    }

    @Test
    void negativeFeatureOtherThanLeaf_isRejected() throws Exception {
        FileArtifactRepository repo = new FileArtifactRepository(dir);
        repo.save(withTree(new IsolationTree(new int[] { -3 }, new double[] { 0.0 },
                new int[] { -1 }, new int[] { -1 }, new int[] { 2 })));

        IOException e = assertThrows(IOException.class, () -> repo.load(1));
        assertTrue(e.getMessage().contains("unknown feature"), e.getMessage());
    }

    @Test
    void garbledFile_isRejected() throws Exception {
        Files.writeString(dir.resolve(FileArtifactRepository.fileName(3)), "{\"version\": 3");
        FileArtifactRepository repo = new FileArtifactRepository(dir);

        assertEquals(3, repo.latestVersion());
        assertThrows(IOException.class, repo::latest);
    }

    @Test
    void unrelatedFiles_areIgnored() throws Exception {
        Files.writeString(dir.resolve("README.txt"), "models");
        Files.writeString(dir.resolve("model-abc.json"), "{}");
        assertEquals(0, new FileArtifactRepository(dir).latestVersion());
    }
}
