package com.project.hatchmark.ledger;

import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.util.Locale;
import java.util.Objects;

/**
 * secp256k1 signer over an in-memory key pair. Signs the canonical descriptor bytes.
 */
public class KeyPairSigner implements Signer {

    private final ECKeyPair keyPair;
    private final String address;

    public KeyPairSigner(ECKeyPair keyPair) {
        this.keyPair = Objects.requireNonNull(keyPair, "keyPair must not be null");
        this.address = Numeric.prependHexPrefix(Keys.getAddress(keyPair)).toLowerCase(Locale.ROOT);
    }

    /**
     * @param privateKeyHex 32-byte private key, with or without {@code 0x}
     */
    public static KeyPairSigner fromPrivateKey(String privateKeyHex) {
        return new KeyPairSigner(ECKeyPair.create(Numeric.toBigInt(privateKeyHex)));
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    public SignedTransaction sign(UnsignedTransaction transaction) {
        if (!address.equalsIgnoreCase(transaction.sender())) {
            throw new IllegalArgumentException(
                String.format("Transaction sender %s does not match signer %s", transaction.sender(), address));
        }
        byte[] txBytes = TransactionCodec.encode(transaction);
        Sign.SignatureData signature = Sign.signMessage(txBytes, keyPair);
        return new SignedTransaction(transaction, txBytes, TransactionCodec.signatureToHex(signature));
    }
}
