package com.flagship.wallet_ledger.ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class WalletNotFoundException extends LedgerException {

    private final UUID walletId;

    public WalletNotFoundException(UUID walletId) {
        super("Wallet not found: " + walletId);
        this.walletId = walletId;
    }

    @Override
    public String getErrorCode() {
        return "wallet_not_found";
    }
}
