package com.flagship.wallet_ledger.ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Raised when a debit would take a wallet balance below zero.
 */
@Getter
public class InsufficientBalanceException extends LedgerException {

    private final UUID walletId;
    private final BigDecimal balance;
    private final BigDecimal amount;

    public InsufficientBalanceException(UUID walletId, BigDecimal balance, BigDecimal amount) {
        super(String.format("Wallet %s has balance %s, cannot apply %s",
            walletId, balance.toPlainString(), amount.toPlainString()));
        this.walletId = walletId;
        this.balance = balance;
        this.amount = amount;
    }

    @Override
    public String getErrorCode() {
        return "insufficient_balance";
    }
}
