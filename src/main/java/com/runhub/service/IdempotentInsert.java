package com.runhub.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Insert-or-read-existing against a unique key.
 *
 * HOW IT WORKS:
 *   1. Read by the unique key. Found → return it, nothing written.
 *   2. Not found → insert in a NEW transaction (REQUIRES_NEW).
 *   3. The insert loses a race → the database raises a uniqueness violation,
 *      which only rolls back that inner transaction.
 *   4. Re-read by the same key in a fresh transaction and return the winner.
 *
 * The database constraint is the only arbiter between concurrent writers;
 * there is no application-level locking. The insert supplier must flush
 * (saveAndFlush) so the violation surfaces inside step 2.
 */
@Component
@Slf4j
public class IdempotentInsert {

    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;

    public IdempotentInsert(PlatformTransactionManager transactionManager) {
        this.writeTx = new TransactionTemplate(transactionManager);
        this.writeTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTx.setReadOnly(true);
    }

    public <T> Result<T> insertOrFetch(Supplier<T> insert, Supplier<Optional<T>> fetch) {
        Optional<T> existing = readTx.execute(status -> fetch.get());
        if (existing != null && existing.isPresent()) {
            return new Result<>(existing.get(), false);
        }

        try {
            return new Result<>(writeTx.execute(status -> insert.get()), true);
        } catch (DataIntegrityViolationException e) {
            log.debug("Insert lost uniqueness race, re-reading: {}", e.getMostSpecificCause().getMessage());
            Optional<T> winner = readTx.execute(status -> fetch.get());
            if (winner == null || winner.isEmpty()) {
                // Violation on some other constraint; nothing to fall back to
                throw e;
            }
            return new Result<>(winner.get(), false);
        }
    }

    /**
     * Like {@link #insertOrFetch} but applies {@code update} to a row that already
     * existed, in its own write transaction. Last writer wins.
     */
    public <T> Result<T> upsert(Supplier<T> insert, Supplier<Optional<T>> fetch, UnaryOperator<T> update) {
        Result<T> result = insertOrFetch(insert, fetch);
        if (result.isInserted()) {
            return result;
        }
        T updated = writeTx.execute(status -> update.apply(result.getValue()));
        return new Result<>(updated, false);
    }

    @Getter
    public static class Result<T> {
        private final T value;
        private final boolean inserted;

        Result(T value, boolean inserted) {
            this.value = value;
            this.inserted = inserted;
        }
    }
}
