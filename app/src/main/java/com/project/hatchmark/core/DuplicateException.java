package com.project.hatchmark.core;

import com.project.hatchmark.match.Match;

/**
 * A near-duplicate of the candidate fingerprint is already registered at or above the
 * register threshold. Carries the best match so callers can show the existing certificate.
 */
public class DuplicateException extends HatchmarkException {

    private final transient Match<?> bestMatch;

    public DuplicateException(String message, Match<?> bestMatch) {
        super(ErrorCode.DUPLICATE, message);
        this.bestMatch = bestMatch;
    }

    public Match<?> bestMatch() {
        return bestMatch;
    }
}
