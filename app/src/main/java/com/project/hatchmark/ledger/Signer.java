package com.project.hatchmark.ledger;

/**
 * Holder of a private key (a wallet, a hardware key, a local key pair).
 */
public interface Signer {

    /**
     * Address transactions are sent from; {@code 0x}-prefixed, lowercase.
     */
    String address();

    SignedTransaction sign(UnsignedTransaction transaction);
}
