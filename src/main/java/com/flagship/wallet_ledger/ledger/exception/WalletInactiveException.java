package com.flagship.wallet_ledger.ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Raised when a transaction is applied to a deactivated wallet.
 * Deactivating again and relabelling are allowed and never raise this.
 */
@Getter
public class WalletInactiveException extends LedgerException {

    private final UUID walletId;

    public WalletInactiveException(UUID walletId) {
        super("Wallet " + walletId + " is deactivated and no longer accepts transactions");
        this.walletId = walletId;
    }

    @Override
    public String getErrorCode() {
        return "wallet_inactive";
    }
}
