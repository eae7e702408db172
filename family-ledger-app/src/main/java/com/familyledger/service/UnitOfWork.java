package com.familyledger.service;

import com.familyledger.config.EngineConfig;
import com.familyledger.exception.StorageUnavailableException;
import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.RetryListener;
import com.github.rholder.retry.Retryer;
import com.github.rholder.retry.RetryerBuilder;
import com.github.rholder.retry.StopStrategies;
import com.github.rholder.retry.WaitStrategies;
import com.google.common.base.Throwables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs engine work in one database transaction. Entity writes, invariant checks and the
 * ledger append all happen inside the callback, so they commit or roll back together.
 *
 * <p>Transient storage faults restart the whole unit a bounded number of times and then
 * surface as {@link StorageUnavailableException}. Domain errors roll back and propagate
 * untouched. Work started inside an existing transaction joins it and is not retried on its
 * own; the outermost unit owns the retry.
 */
@Component
public class UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final EngineConfig config;

    public UnitOfWork(PlatformTransactionManager transactionManager, EngineConfig config) {
        this.config = config;
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.readTemplate.setReadOnly(true);
    }

    public <T> T write(Supplier<T> work) {
        return run(writeTemplate, work);
    }

    public void writeVoid(Runnable work) {
        run(writeTemplate, () -> {
            work.run();
            return null;
        });
    }

    public <T> T read(Supplier<T> work) {
        return run(readTemplate, work);
    }

    private <T> T run(TransactionTemplate template, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }
        int attempts = Math.max(1, config.getStorageRetryAttempts());
        Retryer<T> retryer = RetryerBuilder.<T>newBuilder()
            .retryIfException(UnitOfWork::isTransient)
            .withWaitStrategy(WaitStrategies.fixedWait(config.getStorageRetryBackoff().toMillis(), TimeUnit.MILLISECONDS))
            .withStopStrategy(StopStrategies.stopAfterAttempt(attempts))
            .withRetryListener(new RetryListener() {
                @Override
                public <V> void onRetry(Attempt<V> attempt) {
                    if (attempt.hasException()) {
                        log.warn("Storage fault on attempt {}/{}: {}", attempt.getAttemptNumber(), attempts,
                            attempt.getExceptionCause().getMessage());
                    }
                }
            })
            .build();
        try {
            return retryer.call(() -> template.execute(status -> work.get()));
        } catch (ExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw new IllegalStateException("Unit of work failed", e.getCause());
        } catch (RetryException e) {
            Attempt<?> last = e.getLastFailedAttempt();
            Throwable cause = last.hasException() ? last.getExceptionCause() : e;
            throw new StorageUnavailableException("Storage unavailable after " + e.getNumberOfFailedAttempts()
                + " attempts", cause);
        }
    }

    static boolean isTransient(Throwable e) {
        return e instanceof TransientDataAccessException
            || e instanceof RecoverableDataAccessException
            || e instanceof DataAccessResourceFailureException
            || e instanceof CannotCreateTransactionException;
    }
}
