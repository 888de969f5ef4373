package com.project.hatchmark.ledger;

import java.util.Locale;

/**
 * Verdict a certificate creator gives on a dispute.
 * {@code VALID} upholds the flag (stake back to the flagger); {@code INVALID} rejects it
 * (stake forfeited to the creator).
 */
public enum Resolution {
    VALID,
    INVALID;

    public DisputeStatus toStatus() {
        return this == VALID ? DisputeStatus.VALID : DisputeStatus.INVALID;
    }

    public static Resolution parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("resolution must not be null");
        }
        return Resolution.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
