package com.flagship.wallet_ledger.ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Raised when a credit would push a wallet balance past what the balance column can hold.
 */
@Getter
public class BalanceLimitExceededException extends LedgerException {

    private final UUID walletId;
    private final BigDecimal balance;
    private final BigDecimal amount;

    public BalanceLimitExceededException(UUID walletId, BigDecimal balance, BigDecimal amount) {
        super(String.format("Wallet %s has balance %s, applying %s would exceed the balance limit",
            walletId, balance.toPlainString(), amount.toPlainString()));
        this.walletId = walletId;
        this.balance = balance;
        this.amount = amount;
    }

    @Override
    public String getErrorCode() {
        return "balance_limit_exceeded";
    }
}
