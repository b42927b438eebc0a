package com.flagship.wallet_ledger.ledger;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Ledger settings bound from the {@code ledger.*} keys.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    @Valid
    private final Lock lock = new Lock();

    @Valid
    private final WalletSettings wallet = new WalletSettings();

    @Data
    public static class Lock {
        /**
         * Default wait for exclusive access to a wallet.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class WalletSettings {
        @Min(1)
        private int labelMaxLength = 255;
    }
}
