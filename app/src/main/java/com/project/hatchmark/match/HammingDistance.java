package com.project.hatchmark.match;

import com.project.hatchmark.fingerprint.Fingerprint;

/**
 * Bit distance between fingerprints.
 */
public final class HammingDistance {

    private HammingDistance() {
    }

    /**
     * Number of differing bits, computed per hex digit with XOR and popcount.
     *
     * <p>Fingerprints of different widths are incomparable: the result is the larger of the
     * two widths, i.e. "maximally different", never an exception.
     */
    public static int between(Fingerprint a, Fingerprint b) {
        if (a.hex().length() != b.hex().length()) {
            return Math.max(a.bitWidth(), b.bitWidth());
        }
        int distance = 0;
        for (int i = 0; i < a.hex().length(); i++) {
            distance += Integer.bitCount(a.nibble(i) ^ b.nibble(i));
        }
        return distance;
    }

    /**
     * Similarity percentage {@code round((1 − distance/maxBits) × 100)}, clamped to 0-100.
     */
    public static int similarity(int distance, int maxBits) {
        if (maxBits <= 0) {
            throw new IllegalArgumentException("maxBits must be positive");
        }
        double ratio = 1.0 - (double) distance / maxBits;
        long percent = Math.round(ratio * 100);
        return (int) Math.max(0, Math.min(100, percent));
    }

    public static int similarity(Fingerprint a, Fingerprint b) {
        return similarity(between(a, b), Math.max(a.bitWidth(), b.bitWidth()));
    }
}
