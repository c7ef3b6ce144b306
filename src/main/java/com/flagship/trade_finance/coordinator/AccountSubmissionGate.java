package com.flagship.trade_finance.coordinator;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * At most one in-flight submission per account.
 *
 * Sequences for the same account on different shipments run in parallel, but
 * their individual submissions pass through this gate one at a time, so the
 * account's operations reach the ledger in order.
 *
 * One lock is kept per distinct account ever submitted for and none is
 * evicted, since a lock removed while another thread waits on it would let two
 * submissions through. The map therefore grows with the number of signing
 * participants, which the operator provisions, not with request volume.
 */
public class AccountSubmissionGate {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withAccount(String account, Supplier<T> submission) {
        ReentrantLock lock = locks.computeIfAbsent(account.toLowerCase(Locale.ROOT), a -> new ReentrantLock(true));
        lock.lock();
        try {
            return submission.get();
        } finally {
            lock.unlock();
        }
    }
}
