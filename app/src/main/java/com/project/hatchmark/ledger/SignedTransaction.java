package com.project.hatchmark.ledger;

/**
 * Transaction bytes plus the sender's signature over them.
 *
 * @param transaction the descriptor that was signed
 * @param txBytes     wire encoding produced by the signer
 * @param signature   hex {@code r || s || v}
 */
public record SignedTransaction(UnsignedTransaction transaction, byte[] txBytes, String signature) {

    public String sender() {
        return transaction.sender();
    }
}
