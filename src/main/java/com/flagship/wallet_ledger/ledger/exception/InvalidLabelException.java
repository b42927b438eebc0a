package com.flagship.wallet_ledger.ledger.exception;

public class InvalidLabelException extends LedgerException {

    public InvalidLabelException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "invalid_label";
    }
}
