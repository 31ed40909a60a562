package org.calista.streetsense.ai.semantic;

/**
 * Dense vector helpers. Vectors are plain {@code double[]} of the concept dimension count.
 */
final class Vectors {

    private Vectors() {
    }

    static double norm(double[] v) {
        double s = 0.0;
        for (double x : v) s += x * x;
        return Math.sqrt(s);
    }

    /** In place; a zero vector stays zero. */
    static double[] normalize(double[] v) {
        double n = norm(v);
        if (n == 0.0) return v;
        for (int i = 0; i < v.length; i++) v[i] /= n;
        return v;
    }

    static boolean isZero(double[] v) {
        for (double x : v) if (x != 0.0) return false;
        return true;
    }

    /** Cosine similarity; 0 when either side is a zero vector. */
    static double cosine(double[] a, double[] b) {
        if (a.length != b.length) throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
        double dot = 0.0, na = 0.0, nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0.0 || nb == 0.0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    /** Mean of the vectors, re-normalized to unit length. */
    static double[] centroid(Iterable<double[]> vectors, int dims) {
        double[] c = new double[dims];
        int n = 0;
        for (double[] v : vectors) {
            for (int i = 0; i < dims; i++) c[i] += v[i];
            n++;
        }
        if (n == 0) return c;
        for (int i = 0; i < dims; i++) c[i] /= n;
        return normalize(c);
    }
}
