package com.warden.core.persistence;

import com.warden.core.events.EventLog;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Handle over the shared mutable state: the {@link EventLog}, the
 * {@link UpdateStore}, and the transaction boundary spanning both.
 * <p>
 * Work passed to {@link #inTransaction} commits atomically: if it throws, every
 * event appended and every record mutated inside it is rolled back.
 */
public class Ledger {

    private final EventLog eventLog;
    private final UpdateStore updateStore;
    private final TransactionTemplate transactionTemplate;

    public Ledger(EventLog eventLog, UpdateStore updateStore, TransactionTemplate transactionTemplate) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        this.updateStore = Objects.requireNonNull(updateStore, "updateStore must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
    }

    public EventLog events() {
        return eventLog;
    }

    public UpdateStore updates() {
        return updateStore;
    }

    public <T> T inTransaction(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (TransactionException | DataAccessException e) {
            throw new StorageException("Ledger transaction failed", e);
        }
    }

    public void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }
}
