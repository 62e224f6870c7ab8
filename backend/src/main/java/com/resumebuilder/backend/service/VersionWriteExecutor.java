package com.resumebuilder.backend.service;

import com.resumebuilder.backend.exception.VersionConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a version write as its own transaction and replays it when it loses a race on the
 * per-resume version sequence (unique key collision or lock timeout).
 * <p>
 * Domain errors are never retried. After {@code maxAttempts} lost races the failure surfaces
 * as {@link VersionConflictException}.
 */
@Slf4j
@Component
public class VersionWriteExecutor {

    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;

    public VersionWriteExecutor(PlatformTransactionManager transactionManager,
                                @Value("${app.versions.max-write-attempts:3}") int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("app.versions.max-write-attempts must be at least 1");
        }
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        // Each attempt runs in its own physical transaction, never in the caller's.
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.maxAttempts = maxAttempts;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (DataIntegrityViolationException | PessimisticLockingFailureException ex) {
                lastFailure = ex;
                log.warn("{} lost a concurrent write race (attempt {}/{}): {}",
                        operation, attempt, maxAttempts, ex.getMostSpecificCause().getMessage());
            }
        }
        throw new VersionConflictException(
                "Concurrent modification while running " + operation + ", please retry", lastFailure);
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }
}
