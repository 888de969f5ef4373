package com.project.hatchmark.core;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Input validation utilities for Hatchmark requests.
 *
 * Provides validation for:
 * - Fingerprint hex strings (format, length)
 * - Ledger object ids and addresses
 * - Titles and descriptions (length, control characters)
 * - Numeric boundaries (scores, thresholds, stakes)
 *
 * Every check runs before a transaction descriptor is built, so a request that fails
 * here never reaches the ledger.
 */
public final class InputValidator {

    private static final int HASH_MAX_HEX_LENGTH = 128;
    private static final int TITLE_MAX_LENGTH = 200;
    private static final int DESCRIPTION_MAX_LENGTH = 2000;
    private static final int OBJECT_ID_MAX_HEX_LENGTH = 64;

    private static final Pattern HEX_PATTERN = Pattern.compile("^[0-9a-fA-F]+$");

    // Object ids and addresses: 0x followed by up to 64 hex digits
    private static final Pattern OBJECT_ID_PATTERN = Pattern.compile(
        "^0x[0-9a-fA-F]{1," + OBJECT_ID_MAX_HEX_LENGTH + "}$"
    );

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");

    private InputValidator() {}

    /**
     * Validate a fingerprint hex string and return it normalized
     * (lowercase, without {@code 0x} prefix).
     *
     * @param hash The hex string to validate
     * @param fieldName Name of the field for error messages
     * @return normalized hex
     * @throws ValidationException if validation fails
     */
    public static String validateHash(String hash, String fieldName) {
        if (hash == null) {
            throw new ValidationException(fieldName + " must not be null");
        }
        String trimmed = hash.trim();
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            trimmed = trimmed.substring(2);
        }
        if (trimmed.isEmpty()) {
            throw new ValidationException(fieldName + " must not be empty");
        }
        if (trimmed.length() > HASH_MAX_HEX_LENGTH) {
            throw new ValidationException(
                String.format("%s must be at most %d hex characters: length %d exceeds maximum",
                    fieldName, HASH_MAX_HEX_LENGTH, trimmed.length())
            );
        }
        if (!HEX_PATTERN.matcher(trimmed).matches()) {
            throw new ValidationException(
                String.format("%s is not a hex string: '%s'", fieldName, trimmed)
            );
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Check if a hash is valid without throwing.
     */
    public static boolean isValidHash(String hash) {
        try {
            validateHash(hash, "hash");
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * Validate a ledger object id or address and return it lowercased.
     *
     * @param id The id to validate
     * @param fieldName Name of the field for error messages
     * @return normalized id
     * @throws ValidationException if validation fails
     */
    public static String validateObjectId(String id, String fieldName) {
        if (id == null) {
            throw new ValidationException(fieldName + " must not be null");
        }
        String trimmed = id.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException(fieldName + " must not be empty");
        }
        if (!OBJECT_ID_PATTERN.matcher(trimmed).matches()) {
            throw new ValidationException(
                String.format("%s has invalid format: '%s'. Expected 0x followed by 1-%d hex digits",
                    fieldName, trimmed, OBJECT_ID_MAX_HEX_LENGTH)
            );
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    public static boolean isValidObjectId(String id) {
        try {
            validateObjectId(id, "id");
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * Validate a certificate title: required, trimmed, bounded, no control characters.
     *
     * @return trimmed title
     */
    public static String validateTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title is required");
        }
        if (CONTROL_CHARS.matcher(title).find()) {
            throw new ValidationException("title contains control characters");
        }
        String trimmed = title.strip();
        if (trimmed.length() > TITLE_MAX_LENGTH) {
            throw new ValidationException(
                String.format("title must be at most %d characters: length %d exceeds maximum",
                    TITLE_MAX_LENGTH, trimmed.length())
            );
        }
        return trimmed;
    }

    /**
     * Validate an optional description. {@code null} becomes the empty string.
     */
    public static String validateDescription(String description) {
        if (description == null) {
            return "";
        }
        if (description.length() > DESCRIPTION_MAX_LENGTH) {
            throw new ValidationException(
                String.format("description must be at most %d characters: length %d exceeds maximum",
                    DESCRIPTION_MAX_LENGTH, description.length())
            );
        }
        if (CONTROL_CHARS.matcher(description).find()) {
            throw new ValidationException("description contains control characters");
        }
        return description;
    }

    /**
     * Validate non-negative value.
     *
     * @param value The value to validate
     * @param fieldName Name of the field for error messages
     * @throws ValidationException if validation fails
     */
    public static void validateNonNegative(long value, String fieldName) {
        if (value < 0) {
            throw new ValidationException(
                String.format("%s must not be negative: got %d", fieldName, value)
            );
        }
    }

    /**
     * Validate positive value.
     */
    public static void validatePositive(long value, String fieldName) {
        if (value <= 0) {
            throw new ValidationException(
                String.format("%s must be positive: got %d", fieldName, value)
            );
        }
    }

    /**
     * Validate value is within range.
     *
     * @param value The value to validate
     * @param min Minimum value (inclusive)
     * @param max Maximum value (inclusive)
     * @param fieldName Name of the field for error messages
     * @throws ValidationException if validation fails
     */
    public static void validateRange(long value, long min, long max, String fieldName) {
        if (value < min || value > max) {
            throw new ValidationException(
                String.format("%s must be in range [%d, %d]: got %d",
                    fieldName, min, max, value)
            );
        }
    }
}
