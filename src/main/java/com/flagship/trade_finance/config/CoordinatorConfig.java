package com.flagship.trade_finance.config;

import com.flagship.trade_finance.coordinator.AccountSubmissionGate;
import com.flagship.trade_finance.coordinator.CoordinatorSettings;
import com.flagship.trade_finance.coordinator.KeyedSequencer;
import com.flagship.trade_finance.coordinator.TransactionCoordinator;
import com.flagship.trade_finance.error.ErrorClassifier;
import com.flagship.trade_finance.ledger.LedgerClient;
import com.flagship.trade_finance.lifecycle.LifecycleStateMachine;
import com.flagship.trade_finance.observability.ActionMetrics;
import com.flagship.trade_finance.reconcile.BalanceReconciler;
import com.flagship.trade_finance.reconcile.ShipmentStateStore;
import com.flagship.trade_finance.validation.PreconditionValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;

/**
 * Wires the transaction coordinator and the threads it and the reconciler run on.
 */
@Configuration
public class CoordinatorConfig {

    @Bean
    public CoordinatorSettings coordinatorSettings(
            @Value("${coordinator.confirmations:1}") int confirmations,
            @Value("${coordinator.confirmation-timeout-ms:30000}") long confirmationTimeoutMs,
            @Value("${coordinator.nonce-backoff-ms:2000}") long nonceBackoffMs,
            @Value("${coordinator.worker-threads:8}") int workerThreads) {
        return CoordinatorSettings.builder()
                .confirmations(confirmations)
                .confirmationTimeout(Duration.ofMillis(confirmationTimeoutMs))
                .nonceBackoff(Duration.ofMillis(nonceBackoffMs))
                .workerThreads(workerThreads)
                .build();
    }

    /**
     * Runs sequenced action tasks.
     */
    @Bean
    public ThreadPoolTaskExecutor coordinatorExecutor(CoordinatorSettings settings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getWorkerThreads());
        executor.setMaxPoolSize(settings.getWorkerThreads());
        executor.setThreadNamePrefix("coordinator-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    /**
     * Runs blocking confirmation waits so they can be abandoned on timeout.
     */
    @Bean
    public ThreadPoolTaskExecutor confirmationExecutor(CoordinatorSettings settings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getWorkerThreads());
        executor.setMaxPoolSize(settings.getWorkerThreads() * 2);
        executor.setThreadNamePrefix("confirmation-");
        executor.initialize();
        return executor;
    }

    /**
     * Periodic work: reconciler polling, the outbox publisher, metric refresh
     * and resolution of indeterminate actions. Also picked up by {@code @Scheduled}.
     */
    @Bean
    public ThreadPoolTaskScheduler reconcilerScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public KeyedSequencer keyedSequencer(@Qualifier("coordinatorExecutor") ThreadPoolTaskExecutor executor) {
        return new KeyedSequencer(executor);
    }

    @Bean
    public AccountSubmissionGate accountSubmissionGate() {
        return new AccountSubmissionGate();
    }

    @Bean
    public TransactionCoordinator transactionCoordinator(LedgerClient ledgerClient,
                                                         PreconditionValidator validator,
                                                         ErrorClassifier classifier,
                                                         BalanceReconciler reconciler,
                                                         ShipmentStateStore store,
                                                         LifecycleStateMachine lifecycle,
                                                         ActionMetrics metrics,
                                                         CoordinatorSettings settings,
                                                         KeyedSequencer sequencer,
                                                         AccountSubmissionGate gate,
                                                         @Qualifier("confirmationExecutor") ThreadPoolTaskExecutor confirmationExecutor) {
        return new TransactionCoordinator(ledgerClient, validator, classifier, reconciler, store, lifecycle,
                metrics, settings, sequencer, gate, confirmationExecutor);
    }
}
