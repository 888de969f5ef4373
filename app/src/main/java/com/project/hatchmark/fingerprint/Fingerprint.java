package com.project.hatchmark.fingerprint;

import com.project.hatchmark.core.InputValidator;

/**
 * Fixed-length perceptual fingerprint, rendered as lowercase hex without prefix.
 *
 * <p>The bit width is four times the hex length. The protocol width is {@link #PROTOCOL_BITS};
 * fingerprints of other widths can still be parsed (legacy schemes) but never match a
 * protocol-width fingerprint.
 *
 * @param hex lowercase hex digits, most significant bit first
 */
public record Fingerprint(String hex) {

    public static final int PROTOCOL_BITS = 64;

    public Fingerprint {
        hex = InputValidator.validateHash(hex, "fingerprint");
    }

    /**
     * Parse hex, accepting an optional {@code 0x} prefix and upper-case digits.
     */
    public static Fingerprint parse(String hex) {
        return new Fingerprint(hex);
    }

    /**
     * Pack a bit string (row-major, most significant bit first) into a fingerprint.
     * The number of bits must be a multiple of four.
     */
    public static Fingerprint fromBits(boolean[] bits) {
        if (bits.length == 0 || bits.length % 4 != 0) {
            throw new IllegalArgumentException("bit count must be a positive multiple of 4: " + bits.length);
        }
        StringBuilder builder = new StringBuilder(bits.length / 4);
        for (int i = 0; i < bits.length; i += 4) {
            int nibble = (bits[i] ? 8 : 0) | (bits[i + 1] ? 4 : 0) | (bits[i + 2] ? 2 : 0) | (bits[i + 3] ? 1 : 0);
            builder.append(Character.forDigit(nibble, 16));
        }
        return new Fingerprint(builder.toString());
    }

    public int bitWidth() {
        return hex.length() * 4;
    }

    /**
     * Value of the hex digit at {@code index}, 0-15.
     */
    public int nibble(int index) {
        return Character.digit(hex.charAt(index), 16);
    }

    public boolean isProtocolWidth() {
        return bitWidth() == PROTOCOL_BITS;
    }

    @Override
    public String toString() {
        return hex;
    }
}
