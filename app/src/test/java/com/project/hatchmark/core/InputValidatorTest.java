package com.project.hatchmark.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InputValidator Tests")
class InputValidatorTest {

    @Nested
    @DisplayName("Hash Validation")
    class HashValidation {

        @Test
        @DisplayName("Strips prefix and lowercases")
        void testNormalizes() {
            assertEquals("00ff00ff00ff00ff", InputValidator.validateHash(" 0x00FF00FF00ff00ff ", "hash"));
        }

        @Test
        @DisplayName("Rejects null, empty, non-hex and oversized input")
        void testRejects() {
            assertThrows(ValidationException.class, () -> InputValidator.validateHash(null, "hash"));
            assertThrows(ValidationException.class, () -> InputValidator.validateHash("0x", "hash"));
            assertThrows(ValidationException.class, () -> InputValidator.validateHash("00zz", "hash"));
            assertThrows(ValidationException.class, () -> InputValidator.validateHash("a".repeat(129), "hash"));
            assertFalse(InputValidator.isValidHash("not hex"));
            assertTrue(InputValidator.isValidHash("abc"));
        }
    }

    @Nested
    @DisplayName("Object Id Validation")
    class ObjectIdValidation {

        @Test
        @DisplayName("Accepts 0x-prefixed hex up to 64 digits")
        void testAccepts() {
            assertEquals("0x0", InputValidator.validateObjectId("0x0", "id"));
            assertEquals("0x" + "a".repeat(64), InputValidator.validateObjectId("0x" + "A".repeat(64), "id"));
        }

        @Test
        @DisplayName("Rejects missing prefix and overlong ids")
        void testRejects() {
            assertThrows(ValidationException.class, () -> InputValidator.validateObjectId("abc", "id"));
            assertThrows(ValidationException.class, () -> InputValidator.validateObjectId("0x" + "a".repeat(65), "id"));
            assertThrows(ValidationException.class, () -> InputValidator.validateObjectId("  ", "id"));
            assertFalse(InputValidator.isValidObjectId(null));
        }
    }

    @Nested
    @DisplayName("Text Validation")
    class TextValidation {

        @Test
        @DisplayName("Titles are required, trimmed and bounded")
        void testTitle() {
            assertEquals("Harbour", InputValidator.validateTitle("  Harbour "));
            assertThrows(ValidationException.class, () -> InputValidator.validateTitle(" "));
            assertThrows(ValidationException.class, () -> InputValidator.validateTitle("x".repeat(201)));
            assertThrows(ValidationException.class, () -> InputValidator.validateTitle("bell\u0007"));
        }

        @Test
        @DisplayName("Control characters at either end of a title are rejected, not trimmed")
        void testTitleEdgeControlCharacters() {
            assertThrows(ValidationException.class, () -> InputValidator.validateTitle("\u001bHarbour"));
            assertThrows(ValidationException.class, () -> InputValidator.validateTitle("Harbour\u0000"));
            assertThrows(ValidationException.class, () -> InputValidator.validateTitle(" Harbour \u0007 "));
            assertEquals("Harbour", InputValidator.validateTitle("\tHarbour\n"));
        }

        @Test
        @DisplayName("Descriptions are optional and may span lines")
        void testDescription() {
            assertEquals("", InputValidator.validateDescription(null));
            assertEquals("line one\nline two", InputValidator.validateDescription("line one\nline two"));
            assertThrows(ValidationException.class, () -> InputValidator.validateDescription("x".repeat(2001)));
        }
    }

    @Nested
    @DisplayName("Numeric Validation")
    class NumericValidation {

        @Test
        @DisplayName("Range bounds are inclusive")
        void testRange() {
            assertDoesNotThrow(() -> InputValidator.validateRange(0, 0, 255, "score"));
            assertDoesNotThrow(() -> InputValidator.validateRange(255, 0, 255, "score"));
            assertThrows(ValidationException.class, () -> InputValidator.validateRange(256, 0, 255, "score"));
        }

        @Test
        @DisplayName("Sign checks")
        void testSign() {
            assertDoesNotThrow(() -> InputValidator.validateNonNegative(0, "stake"));
            assertThrows(ValidationException.class, () -> InputValidator.validateNonNegative(-1, "stake"));
            assertThrows(ValidationException.class, () -> InputValidator.validatePositive(0, "limit"));
        }
    }
}
