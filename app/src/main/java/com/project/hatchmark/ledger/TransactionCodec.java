package com.project.hatchmark.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * Canonical encoding, digests, ids and signature recovery for transaction descriptors.
 */
public final class TransactionCodec {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private TransactionCodec() {
    }

    /**
     * Deterministic JSON bytes of the descriptor (map keys sorted).
     */
    public static byte[] encode(UnsignedTransaction transaction) {
        try {
            return CANONICAL.writeValueAsBytes(transaction);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode transaction " + transaction.target(), e);
        }
    }

    public static UnsignedTransaction decode(byte[] txBytes) {
        try {
            return CANONICAL.readValue(txBytes, UnsignedTransaction.class);
        } catch (java.io.IOException e) {
            throw new IllegalArgumentException("Malformed transaction bytes: " + e.getMessage(), e);
        }
    }

    /**
     * Blake2b-256 digest, {@code 0x}-prefixed hex.
     */
    public static String digest(byte[] data) {
        return Numeric.toHexString(blake2b256(data));
    }

    /**
     * Id of the {@code index}-th object created by the transaction with digest {@code txDigest}.
     */
    public static String objectId(String txDigest, int index) {
        byte[] digestBytes = Numeric.hexStringToByteArray(txDigest);
        byte[] input = ByteBuffer.allocate(digestBytes.length + Integer.BYTES)
                .put(digestBytes)
                .putInt(index)
                .array();
        return Numeric.toHexString(blake2b256(input));
    }

    public static String signatureToHex(Sign.SignatureData signature) {
        byte[] packed = new byte[65];
        System.arraycopy(signature.getR(), 0, packed, 0, 32);
        System.arraycopy(signature.getS(), 0, packed, 32, 32);
        packed[64] = signature.getV()[0];
        return Numeric.toHexString(packed);
    }

    /**
     * Address ({@code 0x} + 40 hex) of the key that produced {@code signatureHex} over {@code message}.
     *
     * @throws SignatureException if the signature is malformed or does not recover
     */
    public static String recoverSigner(byte[] message, String signatureHex) throws SignatureException {
        byte[] packed = Numeric.hexStringToByteArray(signatureHex);
        if (packed.length != 65) {
            throw new SignatureException("signature must be 65 bytes, got " + packed.length);
        }
        Sign.SignatureData data = new Sign.SignatureData(
                packed[64],
                Arrays.copyOfRange(packed, 0, 32),
                Arrays.copyOfRange(packed, 32, 64));
        BigInteger publicKey = Sign.signedMessageToKey(message, data);
        return Numeric.prependHexPrefix(Keys.getAddress(publicKey));
    }

    static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] blake2b256(byte[] data) {
        Blake2bDigest digest = new Blake2bDigest(256);
        digest.update(data, 0, data.length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }
}
