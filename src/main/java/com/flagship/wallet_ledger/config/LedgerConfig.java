package com.flagship.wallet_ledger.config;

import com.flagship.wallet_ledger.ledger.LedgerProperties;
import com.flagship.wallet_ledger.ledger.LocalWalletLockManager;
import com.flagship.wallet_ledger.ledger.WalletLockManager;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Wiring for the ledger core.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

    /**
     * Every ledger mutation runs in its own transaction that commits before the
     * wallet lock is released, so it must never join an outer one.
     */
    @Bean
    public TransactionTemplate ledgerTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        return template;
    }

    @Bean
    public WalletLockManager walletLockManager() {
        return new LocalWalletLockManager();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
