package com.flagship.wallet_ledger.ledger.exception;

import lombok.Getter;

@Getter
public class TransactionNotFoundException extends LedgerException {

    private final String txid;

    public TransactionNotFoundException(String txid) {
        super("Transaction not found: txid=" + txid);
        this.txid = txid;
    }

    @Override
    public String getErrorCode() {
        return "transaction_not_found";
    }
}
