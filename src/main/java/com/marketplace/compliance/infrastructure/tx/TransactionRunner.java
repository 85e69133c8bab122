package com.marketplace.compliance.infrastructure.tx;

import java.util.function.Supplier;

/**
 * Runs a unit of work inside one database transaction.
 *
 * The unit commits when the work returns normally and rolls back when it throws.
 * Services that need a post-commit step, or one transaction per item in a loop,
 * use this instead of a method-level {@code @Transactional}.
 */
public interface TransactionRunner {

    <T> T inTransaction(Supplier<T> work);

    default void run(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Whether the calling thread currently runs inside a transaction.
     */
    boolean isTransactionActive();
}
