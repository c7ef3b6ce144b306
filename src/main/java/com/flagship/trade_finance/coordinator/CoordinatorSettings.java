package com.flagship.trade_finance.coordinator;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tunables of the transaction coordinator.
 */
@Value
@Builder
public class CoordinatorSettings {
    @Builder.Default
    int confirmations = 1;
    @Builder.Default
    Duration confirmationTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration nonceBackoff = Duration.ofSeconds(2);
    @Builder.Default
    int workerThreads = 8;
}
