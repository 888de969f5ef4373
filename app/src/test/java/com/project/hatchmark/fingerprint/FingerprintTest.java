package com.project.hatchmark.fingerprint;

import com.project.hatchmark.core.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Fingerprint value")
class FingerprintTest {

    @Test
    @DisplayName("Prefix and upper case are normalised away")
    void testNormalisation() {
        Fingerprint fingerprint = Fingerprint.parse("0xABCDEF0123456789");

        assertEquals("abcdef0123456789", fingerprint.hex());
        assertEquals(Fingerprint.parse("abcdef0123456789"), fingerprint);
        assertTrue(fingerprint.isProtocolWidth());
    }

    @Test
    @DisplayName("Bit width is four bits per hex digit")
    void testBitWidth() {
        assertEquals(64, Fingerprint.parse("ffffffffffffffff").bitWidth());
        assertEquals(40, Fingerprint.parse("ffffffffff").bitWidth());
        assertFalse(Fingerprint.parse("ffffffffff").isProtocolWidth());
    }

    @Test
    @DisplayName("Non-hex and empty input are rejected")
    void testInvalid() {
        assertThrows(ValidationException.class, () -> Fingerprint.parse(""));
        assertThrows(ValidationException.class, () -> Fingerprint.parse("0x"));
        assertThrows(ValidationException.class, () -> Fingerprint.parse("xyz0123456789abc"));
        assertThrows(ValidationException.class, () -> Fingerprint.parse(null));
    }

    @Test
    @DisplayName("Bits pack most significant first")
    void testFromBits() {
        boolean[] bits = new boolean[8];
        bits[0] = true;
        bits[7] = true;

        assertEquals("81", Fingerprint.fromBits(bits).hex());
        assertThrows(IllegalArgumentException.class, () -> Fingerprint.fromBits(new boolean[3]));
    }
}
