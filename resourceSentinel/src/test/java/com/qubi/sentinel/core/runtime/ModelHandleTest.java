package com.qubi.sentinel.core.runtime;

import com.qubi.sentinel.core.model.EnsembleParams;
import com.qubi.sentinel.core.model.MetricSample;
import com.qubi.sentinel.core.model.ModelArtifact;
import com.qubi.sentinel.core.model.ScalerParams;
import com.qubi.sentinel.ml.IsolationTree;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelHandleTest {

    private static ModelArtifact version(long v) {
        IsolationTree leaf = new IsolationTree(new int[] { -1 }, new double[] { 0 },
                new int[] { -1 }, new int[] { -1 }, new int[] { 2 });
        return new ModelArtifact(ModelArtifact.FORMAT_VERSION, v, Instant.EPOCH, 2, MetricSample.FEATURES,
                new ScalerParams(new double[3], new double[3]), new EnsembleParams(1, 2, 1, 0),
                0.05, 0.5, List.of(leaf));
    }

    @Test
    void empty_untilFirstPublish() {
        ModelHandle h = new ModelHandle();
        assertTrue(h.current().isEmpty());
        assertTrue(h.publish(version(1)));
        assertEquals(1, h.current().orElseThrow().version());
    }

    @Test
    void olderOrSameVersion_doesNotReplace() {
        ModelArtifact v2 = version(2);
        ModelHandle h = new ModelHandle(v2);

        assertFalse(h.publish(version(1)));
        assertFalse(h.publish(version(2)));
        assertSame(v2, h.current().orElseThrow());

        assertTrue(h.publish(version(3)));
        assertEquals(3, h.current().orElseThrow().version());
    }

    @Test
    void concurrentPublishers_endOnHighestVersion() throws Exception {
        ModelHandle h = new ModelHandle();
        Thread[] threads = new Thread[8];
        for (int t = 0; t < threads.length; t++) {
            int offset = t;
            threads[t] = new Thread(() -> {
                for (int v = 1 + offset; v <= 400; v += threads.length) h.publish(version(v));
            });
            threads[t].start();
        }
        for (Thread t : threads) t.join();
        assertEquals(400, h.current().orElseThrow().version());
    }
}
