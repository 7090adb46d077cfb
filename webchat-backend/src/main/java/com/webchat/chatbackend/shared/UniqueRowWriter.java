package com.webchat.chatbackend.shared;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.BooleanSupplier;

/**
 * Inserts a row guarded by a unique key in its own transaction, so that losing
 * a race against an identical concurrent insert leaves the caller's
 * transaction usable.
 */
@Component
@Slf4j
public class UniqueRowWriter {

    private final TransactionTemplate isolated;

    public UniqueRowWriter(PlatformTransactionManager transactionManager) {
        this.isolated = new TransactionTemplate(transactionManager);
        this.isolated.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Runs {@code insert}, which must flush. Returns true when this call wrote
     * the row and false when the key was taken concurrently, as confirmed by
     * {@code alreadyPresent}. Any other constraint failure is rethrown.
     */
    public boolean insert(Runnable insert, BooleanSupplier alreadyPresent) {
        try {
            isolated.executeWithoutResult(status -> insert.run());
            return true;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            if (!alreadyPresent.getAsBoolean()) {
                throw e;
            }
            log.debug("Duplicate insert resolved in favour of the existing row: {}", mostSpecific(e));
            return false;
        }
    }

    private static String mostSpecific(DataAccessException e) {
        return e.getMostSpecificCause().getMessage();
    }
}
