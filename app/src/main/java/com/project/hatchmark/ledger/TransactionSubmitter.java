package com.project.hatchmark.ledger;

import com.project.hatchmark.core.LedgerException;

/**
 * Sends signed transactions to the ledger and waits for execution.
 */
public interface TransactionSubmitter {

    /**
     * @return the execution receipt; a semantic rejection is a receipt with {@code success == false}
     * @throws LedgerException with {@code retryable == true} when the transaction may not have reached the ledger
     */
    TransactionReceipt submit(SignedTransaction transaction);
}
