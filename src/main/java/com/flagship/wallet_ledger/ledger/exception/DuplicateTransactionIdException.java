package com.flagship.wallet_ledger.ledger.exception;

import lombok.Getter;

/**
 * Raised when an external transaction id has already been used by any
 * transaction in any wallet. Detected by the unique constraint at insert time.
 */
@Getter
public class DuplicateTransactionIdException extends LedgerException {

    private final String txid;

    public DuplicateTransactionIdException(String txid) {
        super("Transaction id already exists: " + txid);
        this.txid = txid;
    }

    public DuplicateTransactionIdException(String txid, Throwable cause) {
        super("Transaction id already exists: " + txid, cause);
        this.txid = txid;
    }

    @Override
    public String getErrorCode() {
        return "duplicate_txid";
    }
}
