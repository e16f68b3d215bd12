package com.dailycode.infrastructure.persistence;

import com.dailycode.domain.common.exception.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Runs a store call in its own transaction and reports any persistence failure as the store being unavailable.
 * <p>
 * The translation sits outside the transaction boundary, so failures to open or commit the transaction
 * (an unreachable database surfaces as {@code CannotCreateTransactionException}) are covered as well.
 */
final class StoreTransactions {

    private final TransactionTemplate readTemplate;
    private final TransactionTemplate writeTemplate;
    private final BiFunction<String, Throwable, ? extends StoreUnavailableException> unavailable;

    StoreTransactions(PlatformTransactionManager transactionManager,
                      BiFunction<String, Throwable, ? extends StoreUnavailableException> unavailable) {
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.unavailable = unavailable;
    }

    <T> T read(String action, Supplier<T> call) {
        return execute(readTemplate, action, call);
    }

    <T> T write(String action, Supplier<T> call) {
        return execute(writeTemplate, action, call);
    }

    private <T> T execute(TransactionTemplate template, String action, Supplier<T> call) {
        try {
            return template.execute(status -> call.get());
        } catch (DataAccessException | TransactionException e) {
            throw unavailable.apply("Failed to " + action, e);
        }
    }
}
