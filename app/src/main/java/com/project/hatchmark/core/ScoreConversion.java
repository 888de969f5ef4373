package com.project.hatchmark.core;

import com.project.hatchmark.fingerprint.Fingerprint;
import com.project.hatchmark.match.HammingDistance;

/**
 * The one mapping between a similarity percentage and the on-chain score byte.
 *
 * <pre>
 *   distance   = round((100 - similarity) * 64 / 100)
 *   similarity = round((1 - distance / 64) * 100)
 * </pre>
 *
 * The on-chain score is therefore a Hamming distance over the 64-bit protocol fingerprint.
 * A caller that already has a distance passes it through unchanged.
 */
public final class ScoreConversion {

    public static final int BIT_WIDTH = Fingerprint.PROTOCOL_BITS;
    public static final int MAX_SCORE_BYTE = 255;

    /** Which request field produced the submitted score. */
    public enum Source {
        HAMMING_DISTANCE,
        SIMILARITY_PERCENT
    }

    /**
     * @param distance          value written on-chain
     * @param source            input it was derived from
     * @param similarityPercent the percentage supplied by the caller, or {@code null}
     */
    public record Score(int distance, Source source, Integer similarityPercent) {
    }

    private ScoreConversion() {
    }

    public static int similarityToDistance(int similarityPercent) {
        InputValidator.validateRange(similarityPercent, 0, 100, "similarity");
        return (int) Math.round((100 - similarityPercent) * (double) BIT_WIDTH / 100);
    }

    public static int distanceToSimilarity(int distance) {
        InputValidator.validateRange(distance, 0, MAX_SCORE_BYTE, "hammingDistance");
        return HammingDistance.similarity(distance, BIT_WIDTH);
    }

    /**
     * Pick the submitted score. {@code hammingDistance} wins when both are present.
     *
     * @throws ValidationException if neither is present or the chosen one is out of range
     */
    public static Score resolve(Integer hammingDistance, Integer similarityPercent) {
        if (hammingDistance != null) {
            InputValidator.validateRange(hammingDistance, 0, MAX_SCORE_BYTE, "hammingDistance");
            return new Score(hammingDistance, Source.HAMMING_DISTANCE, similarityPercent);
        }
        if (similarityPercent != null) {
            return new Score(similarityToDistance(similarityPercent), Source.SIMILARITY_PERCENT, similarityPercent);
        }
        throw new ValidationException("either hammingDistance or similarity is required");
    }
}
