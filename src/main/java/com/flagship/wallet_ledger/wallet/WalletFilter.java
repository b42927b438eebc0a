package com.flagship.wallet_ledger.wallet;

import lombok.Builder;
import lombok.Value;

import java.util.Set;
import java.util.UUID;

/**
 * Optional criteria for listing wallets.
 * A null field means "do not filter on this".
 */
@Value
@Builder
public class WalletFilter {
    Boolean active;
    Set<UUID> walletIds;

    public static WalletFilter all() {
        return WalletFilter.builder().build();
    }

    public static WalletFilter activeOnly() {
        return WalletFilter.builder().active(true).build();
    }

    public boolean hasWalletIds() {
        return walletIds != null;
    }

    /**
     * True when the filter asks for an explicit, empty id set, which can never match.
     */
    public boolean matchesNothing() {
        return walletIds != null && walletIds.isEmpty();
    }
}
