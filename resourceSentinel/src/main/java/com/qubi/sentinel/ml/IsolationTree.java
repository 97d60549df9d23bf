package com.qubi.sentinel.ml;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * Árbol de aislamiento en forma plana (un índice por nodo, raíz = 0). Un nodo es hoja
 * cuando {@code feature[i] < 0}. Los puntos con {@code x[feature] < split} van a la izquierda.
 * {@code size} es la cantidad de puntos de entrenamiento que llegaron al nodo.
 *
 * <p>Inmutable: los arrays se copian en el constructor y en cada accessor.
 */
public record IsolationTree(
        @JsonProperty("feature") int[] feature,
        @JsonProperty("split") double[] split,
        @JsonProperty("left") int[] left,
        @JsonProperty("right") int[] right,
        @JsonProperty("size") int[] size
) {
    static final int LEAF = -1;
    private static final double EULER_GAMMA = 0.5772156649;

    public IsolationTree {
        feature = Objects.requireNonNull(feature, "feature").clone();
        split = Objects.requireNonNull(split, "split").clone();
        left = Objects.requireNonNull(left, "left").clone();
        right = Objects.requireNonNull(right, "right").clone();
        size = Objects.requireNonNull(size, "size").clone();
    }

    @Override public int[] feature() { return feature.clone(); }
    @Override public double[] split() { return split.clone(); }
    @Override public int[] left() { return left.clone(); }
    @Override public int[] right() { return right.clone(); }
    @Override public int[] size() { return size.clone(); }

    /**
     * Crece un árbol sobre {@code points} (ya escalados). Cada nodo elige al azar un feature
     * con rango no nulo y un split uniforme en [min, max).
     */
    public static IsolationTree grow(double[][] points, int maxDepth, Random random) {
        int[] idx = new int[points.length];
        for (int i = 0; i < idx.length; i++) idx[i] = i;
        Nodes nodes = new Nodes(Math.max(1, 2 * points.length - 1));
        grow(points, idx, 0, idx.length, 0, maxDepth, random, nodes);
        return nodes.toTree();
    }

    private static int grow(double[][] points, int[] idx, int from, int to, int depth, int maxDepth,
                            Random random, Nodes nodes) {
        int n = to - from;
        int node = nodes.add(n);
        if (n <= 1 || depth >= maxDepth) return node;

        int dims = points[idx[from]].length;
        double[] min = new double[dims];
        double[] max = new double[dims];
        Arrays.fill(min, Double.POSITIVE_INFINITY);
        Arrays.fill(max, Double.NEGATIVE_INFINITY);
        for (int i = from; i < to; i++) {
            double[] p = points[idx[i]];
            for (int j = 0; j < dims; j++) {
                if (p[j] < min[j]) min[j] = p[j];
                if (p[j] > max[j]) max[j] = p[j];
            }
        }
        int[] candidates = new int[dims];
        int k = 0;
        for (int j = 0; j < dims; j++) if (max[j] > min[j]) candidates[k++] = j;
        if (k == 0) return node; // todos los puntos son idénticos

        int f = candidates[random.nextInt(k)];
        double s = min[f] + random.nextDouble() * (max[f] - min[f]);

        int mid = from;
        for (int i = from; i < to; i++) {
            if (points[idx[i]][f] < s) {
                int tmp = idx[mid]; idx[mid] = idx[i]; idx[i] = tmp;
                mid++;
            }
        }
        int l = grow(points, idx, from, mid, depth + 1, maxDepth, random, nodes);
        int r = grow(points, idx, mid, to, depth + 1, maxDepth, random, nodes);
        nodes.split(node, f, s, l, r);
        return node;
    }

    /** Profundidad de la hoja alcanzada más c(size) de esa hoja. */
    public double pathLength(double[] x) {
        int node = 0;
        int depth = 0;
        while (feature[node] != LEAF) {
            node = x[feature[node]] < split[node] ? left[node] : right[node];
            depth++;
        }
        return depth + averagePathLength(size[node]);
    }

    @JsonIgnore
    public int nodeCount() { return feature.length; }

    /**
     * Largo promedio de un camino fallido en un BST de {@code n} nodos; normaliza los largos
     * de camino.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IsolationTree)) return false;
        IsolationTree t = (IsolationTree) o;
        return Arrays.equals(feature, t.feature) && Arrays.equals(split, t.split)
                && Arrays.equals(left, t.left) && Arrays.equals(right, t.right)
                && Arrays.equals(size, t.size);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(feature);
        h = 31 * h + Arrays.hashCode(split);
        h = 31 * h + Arrays.hashCode(left);
        h = 31 * h + Arrays.hashCode(right);
        return 31 * h + Arrays.hashCode(size);
    }

    @Override
    public String toString() {
        return "IsolationTree{nodes=" + feature.length + '}';
    }

    // ===== Builder de nodos =====

    private static final class Nodes {
        int count;
        int[] feature, left, right, size;
        double[] split;

        Nodes(int capacity) {
            feature = new int[capacity]; left = new int[capacity]; right = new int[capacity];
            size = new int[capacity]; split = new double[capacity];
        }

        int add(int n) {
            if (count == feature.length) {
                int cap = count * 2;
                feature = Arrays.copyOf(feature, cap); left = Arrays.copyOf(left, cap);
                right = Arrays.copyOf(right, cap); size = Arrays.copyOf(size, cap);
                split = Arrays.copyOf(split, cap);
            }
            feature[count] = LEAF; left[count] = LEAF; right[count] = LEAF;
            size[count] = n;
            return count++;
        }

        void split(int node, int f, double s, int l, int r) {
            feature[node] = f; split[node] = s; left[node] = l; right[node] = r;
        }

        IsolationTree toTree() {
            return new IsolationTree(Arrays.copyOf(feature, count), Arrays.copyOf(split, count),
                    Arrays.copyOf(left, count), Arrays.copyOf(right, count), Arrays.copyOf(size, count));
        }
    }
}
