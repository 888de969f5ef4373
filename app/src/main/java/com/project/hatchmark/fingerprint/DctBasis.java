package com.project.hatchmark.fingerprint;

/**
 * Precomputed cosine basis for an {@code N×N} type-II DCT.
 *
 * <p>Entry {@code [k][n] = cos(π/N · (n + ½) · k)}. Instances are immutable once built;
 * {@link #standard()} is shared by every hasher and initialised at most once.
 */
public final class DctBasis {

    public static final int STANDARD_SIZE = 32;

    private final int size;
    private final double[][] table;

    public DctBasis(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        this.size = size;
        this.table = new double[size][size];
        for (int k = 0; k < size; k++) {
            for (int n = 0; n < size; n++) {
                table[k][n] = Math.cos((Math.PI / size) * (n + 0.5) * k);
            }
        }
    }

    /**
     * The shared 32×32 basis. Lazily created by the class loader on first use.
     */
    public static DctBasis standard() {
        return Holder.STANDARD;
    }

    public int size() {
        return size;
    }

    public double at(int k, int n) {
        return table[k][n];
    }

    /**
     * Separable 2-D DCT: a 1-D transform over every row, then over every column of the result.
     * The input is not modified.
     *
     * @param matrix {@code size×size} samples, indexed {@code [y][x]}
     * @return coefficients indexed {@code [v][u]} (vertical frequency, horizontal frequency)
     */
    public double[][] transform2d(double[][] matrix) {
        if (matrix.length != size || matrix[0].length != size) {
            throw new IllegalArgumentException(
                String.format("expected %dx%d input, got %dx%d", size, size, matrix.length, matrix[0].length));
        }
        double[][] rows = new double[size][size];
        for (int y = 0; y < size; y++) {
            for (int k = 0; k < size; k++) {
                double sum = 0;
                for (int n = 0; n < size; n++) {
                    sum += matrix[y][n] * table[k][n];
                }
                rows[y][k] = sum;
            }
        }
        double[][] result = new double[size][size];
        for (int k = 0; k < size; k++) {
            for (int x = 0; x < size; x++) {
                double sum = 0;
                for (int n = 0; n < size; n++) {
                    sum += rows[n][x] * table[k][n];
                }
                result[k][x] = sum;
            }
        }
        return result;
    }

    private static final class Holder {
        private static final DctBasis STANDARD = new DctBasis(STANDARD_SIZE);
    }
}
