package com.flagship.wallet_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the wallet events topic. KafkaAdmin creates it on startup if missing.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.wallets:wallet-events}")
    private String walletsTopic;

    @Value("${kafka.topic.wallets-partitions:3}")
    private int partitions;

    /**
     * Events are keyed by wallet id, so partitions only limit consumer parallelism,
     * never per-wallet ordering.
     */
    @Bean
    public NewTopic walletsTopic() {
        return TopicBuilder.name(walletsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
