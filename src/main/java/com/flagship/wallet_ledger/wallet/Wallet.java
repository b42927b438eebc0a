package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.ledger.exception.BalanceLimitExceededException;
import com.flagship.wallet_ledger.ledger.exception.InsufficientBalanceException;
import com.flagship.wallet_ledger.ledger.exception.InvalidLabelException;
import com.flagship.wallet_ledger.ledger.exception.WalletInactiveException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Wallet domain object.
 *
 * Key principles:
 * - Immutable: every mutation returns a new Wallet with a bumped updatedAt
 * - The balance only moves through {@link #applyAmount(BigDecimal, Instant)}
 *   and never goes below zero
 * - Deactivation is terminal; there is no way back to active
 *
 * Persistence lives in {@link WalletEntity}; this class has no JPA annotations.
 */
@Value
public class Wallet {

    /**
     * Integer digits a balance may have: NUMERIC(19,4) leaves 15.
     */
    public static final int MAX_INTEGER_DIGITS = 15;

    UUID id;
    String label;
    BigDecimal balance;
    boolean active;
    Instant deactivatedAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new active wallet with a zero balance.
     * The label is expected to be normalized already.
     */
    public static Wallet create(UUID id, String label, Instant now) {
        return new Wallet(
            id,
            label,
            BigDecimal.ZERO,
            true,
            null,
            now,
            now
        );
    }

    /**
     * Adds a signed amount to the balance.
     *
     * @throws WalletInactiveException if the wallet has been deactivated
     * @throws InsufficientBalanceException if the new balance would be negative
     * @throws BalanceLimitExceededException if the new balance has more than
     *         {@value #MAX_INTEGER_DIGITS} integer digits
     */
    public Wallet applyAmount(BigDecimal amount, Instant now) {
        if (!active) {
            throw new WalletInactiveException(id);
        }
        BigDecimal newBalance = this.balance.add(amount);
        if (newBalance.signum() < 0) {
            throw new InsufficientBalanceException(id, balance, amount);
        }
        if (integerDigits(newBalance) > MAX_INTEGER_DIGITS) {
            throw new BalanceLimitExceededException(id, balance, amount);
        }
        return new Wallet(
            this.id,
            this.label,
            newBalance,
            true,
            null,
            this.createdAt,
            now
        );
    }

    /**
     * Transitions the wallet to the terminal deactivated state.
     *
     * @throws IllegalStateException if the wallet is already deactivated
     */
    public Wallet deactivate(Instant now) {
        if (!active) {
            throw new IllegalStateException(
                String.format("Wallet %s was already deactivated at %s", id, deactivatedAt));
        }
        return new Wallet(
            this.id,
            this.label,
            this.balance,
            false,
            now,
            this.createdAt,
            now
        );
    }

    /**
     * Replaces the label. Allowed in both active and deactivated state.
     */
    public Wallet relabel(String newLabel, Instant now) {
        return new Wallet(
            this.id,
            newLabel,
            this.balance,
            this.active,
            this.deactivatedAt,
            this.createdAt,
            now
        );
    }

    /**
     * Digits left of the decimal point; zero for values below one.
     */
    public static int integerDigits(BigDecimal value) {
        return Math.max(0, value.precision() - value.scale());
    }

    /**
     * Trims a raw label and checks it is non-empty and at most {@code maxLength} characters.
     *
     * @return the trimmed label
     * @throws InvalidLabelException if the label is null, blank or too long
     */
    public static String normalizeLabel(String rawLabel, int maxLength) {
        if (rawLabel == null || rawLabel.isBlank()) {
            throw new InvalidLabelException("Wallet label cannot be empty");
        }
        String trimmed = rawLabel.strip();
        if (trimmed.length() > maxLength) {
            throw new InvalidLabelException(
                String.format("Wallet label must be at most %d characters, got %d", maxLength, trimmed.length()));
        }
        return trimmed;
    }
}
