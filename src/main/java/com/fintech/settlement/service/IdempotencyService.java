package com.fintech.settlement.service;

import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.dto.Reservation;
import com.fintech.settlement.entity.IdempotencyRecord;
import com.fintech.settlement.entity.IdempotencyStatus;
import com.fintech.settlement.repository.IdempotencyRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Serializes logical operations on a unique key stored in the database.
 * <p>
 * Lifecycle of a key:
 * <pre>
 *   reserve  -> IN_FLIGHT   (own transaction, committed before the effect starts)
 *   complete -> COMPLETED   (inside the caller's transaction, atomic with the effect)
 *   release  -> deleted     (the operation failed without effect; a retry may reserve again)
 * </pre>
 * An IN_FLIGHT record whose lease has expired belongs to a crashed worker and may be taken over
 * by exactly one caller; the version column arbitrates.
 */
@Service
@Slf4j
public class IdempotencyService {

    private final IdempotencyRecordRepository repository;
    private final TransactionTemplate newTransaction;
    private final SettlementProperties properties;
    private final Clock clock;

    public IdempotencyService(IdempotencyRecordRepository repository,
                              PlatformTransactionManager transactionManager,
                              SettlementProperties properties,
                              Clock clock) {
        this.repository = repository;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Atomically claims {@code key}. Exactly one concurrent caller gets ACQUIRED.
     */
    public Reservation reserve(String key, String scope) {
        Instant now = clock.instant();
        try {
            newTransaction.executeWithoutResult(status -> repository.saveAndFlush(IdempotencyRecord.builder()
                    .idempotencyKey(key)
                    .scope(scope)
                    .status(IdempotencyStatus.IN_FLIGHT)
                    .leaseExpiresAt(now.plus(properties.getIdempotencyLease()))
                    .createdAt(now)
                    .build()));
            log.debug("Reserved idempotency key={}", key);
            return Reservation.acquired(key);
        } catch (DataIntegrityViolationException e) {
            log.debug("Idempotency key={} already reserved", key);
        }
        return inspectExisting(key, now);
    }

    private Reservation inspectExisting(String key, Instant now) {
        IdempotencyRecord existing = newTransaction.execute(status ->
                repository.findByIdempotencyKey(key).orElse(null));

        if (existing == null) {
            // released between our insert attempt and this read; the releasing worker's retry owns it
            return Reservation.inFlight(key, null);
        }
        if (existing.getStatus() == IdempotencyStatus.COMPLETED) {
            return Reservation.completed(key, existing.getResult());
        }
        if (existing.getLeaseExpiresAt().isAfter(now)) {
            return Reservation.inFlight(key, existing.getResult());
        }
        return takeOver(existing, now);
    }

    private Reservation takeOver(IdempotencyRecord stale, Instant now) {
        try {
            newTransaction.executeWithoutResult(status -> {
                stale.setLeaseExpiresAt(now.plus(properties.getIdempotencyLease()));
                repository.saveAndFlush(stale);
            });
            log.warn("Took over abandoned reservation key={}, scope={}, reservedAt={}",
                    stale.getIdempotencyKey(), stale.getScope(), stale.getCreatedAt());
            return Reservation.acquired(stale.getIdempotencyKey());
        } catch (ObjectOptimisticLockingFailureException e) {
            log.debug("Another worker took over key={} first", stale.getIdempotencyKey());
            return Reservation.inFlight(stale.getIdempotencyKey(), stale.getResult());
        }
    }

    /**
     * Marks the key COMPLETED with its result. Joins the caller's transaction, so the completion
     * is rolled back together with the effect.
     */
    @Transactional
    public void complete(String key, String result) {
        IdempotencyRecord record = repository.findByIdempotencyKey(key)
                .orElseThrow(() -> new IllegalStateException("No reservation for idempotency key " + key));
        if (record.getStatus() == IdempotencyStatus.COMPLETED) {
            if (!Objects.equals(record.getResult(), result)) {
                throw new IllegalStateException("Idempotency key " + key + " already completed with "
                        + record.getResult() + ", refusing " + result);
            }
            return;
        }
        record.setStatus(IdempotencyStatus.COMPLETED);
        record.setResult(result);
        record.setCompletedAt(clock.instant());
        repository.save(record);
        log.debug("Completed idempotency key={} with result={}", key, result);
    }

    /**
     * Drops an IN_FLIGHT reservation after a failure that had no effect. COMPLETED keys are kept.
     */
    public void release(String key) {
        newTransaction.executeWithoutResult(status -> repository.findByIdempotencyKey(key)
                .filter(record -> record.getStatus() == IdempotencyStatus.IN_FLIGHT)
                .ifPresent(record -> {
                    repository.delete(record);
                    log.debug("Released idempotency key={}", key);
                }));
    }

    @Transactional(readOnly = true)
    public Optional<IdempotencyRecord> find(String key) {
        return repository.findByIdempotencyKey(key);
    }
}
