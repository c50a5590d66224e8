package com.fintech.settlement.service;

import com.fintech.settlement.dto.ReconciliationRunResult;
import com.fintech.settlement.dto.StatementImportRequest;
import com.fintech.settlement.entity.ReconciliationRecord;
import com.fintech.settlement.entity.ResolutionStatus;
import com.fintech.settlement.entity.SettlementStatement;
import com.fintech.settlement.exception.InvalidStateTransitionException;
import com.fintech.settlement.exception.ProviderRejectedException;
import com.fintech.settlement.exception.ProviderUnavailableException;
import com.fintech.settlement.exception.ReconciliationException;
import com.fintech.settlement.exception.ResourceNotFoundException;
import com.fintech.settlement.provider.ProviderAdapterRegistry;
import com.fintech.settlement.repository.LedgerEntryRepository;
import com.fintech.settlement.repository.PaymentIntentRepository;
import com.fintech.settlement.repository.ReconciliationRecordRepository;
import com.fintech.settlement.repository.SettlementStatementRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.Builder;
import lombok.Data;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Daily settlement reconciliation: compares what the ledger says arrived in {@code cash:<provider>}
 * on a UTC day with what the provider says it settled.
 * <p>
 * Key Design Decisions:
 * 1. Expected total is the net movement of the cash account over the half-open day
 *    {@code [00:00, next 00:00)}, read through {@link LedgerService#netMovement}; refunds therefore reduce it
 * 2. Reported total comes from the provider's settlement report, else an imported statement
 * 3. The ledger is never modified; a discrepancy waits for an operator
 * 4. One failing tenant/provider pair does not abort the run
 * 5. A run covers pairs with ledger movement, pairs with an imported statement, and every registered
 *    provider for every known tenant; a pair of the last kind with nothing on either side leaves no record
 */
@Service
@Slf4j
public class ReconciliationService {

    private final LedgerService ledgerService;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final PaymentIntentRepository intentRepository;
    private final ReconciliationRecordRepository recordRepository;
    private final SettlementStatementRepository statementRepository;
    private final ProviderAdapterRegistry adapterRegistry;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    // Metrics
    private Counter runCounter;
    private Counter matchedCounter;
    private Counter discrepancyCounter;
    private Counter reportMissingCounter;
    private Counter providerErrorCounter;
    private Timer reconciliationTimer;

    // Prevents concurrent reconciliation runs
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public ReconciliationService(LedgerService ledgerService,
                                 LedgerEntryRepository ledgerEntryRepository,
                                 PaymentIntentRepository intentRepository,
                                 ReconciliationRecordRepository recordRepository,
                                 SettlementStatementRepository statementRepository,
                                 ProviderAdapterRegistry adapterRegistry,
                                 Clock clock,
                                 MeterRegistry meterRegistry) {
        this.ledgerService = ledgerService;
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.intentRepository = intentRepository;
        this.recordRepository = recordRepository;
        this.statementRepository = statementRepository;
        this.adapterRegistry = adapterRegistry;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        runCounter = Counter.builder("reconciliation.runs")
                .description("Reconciliation runs started")
                .register(meterRegistry);

        matchedCounter = Counter.builder("reconciliation.records.matched")
                .description("Tenant/provider days whose totals matched")
                .register(meterRegistry);

        discrepancyCounter = Counter.builder("reconciliation.records.discrepancy")
                .description("Tenant/provider days with a non-zero discrepancy")
                .register(meterRegistry);

        reportMissingCounter = Counter.builder("reconciliation.records.report_missing")
                .description("Tenant/provider days without a provider report")
                .register(meterRegistry);

        providerErrorCounter = Counter.builder("reconciliation.provider.errors")
                .description("Errors fetching provider settlement reports")
                .register(meterRegistry);

        reconciliationTimer = Timer.builder("reconciliation.duration")
                .description("Time taken to complete reconciliation run")
                .register(meterRegistry);
    }

    /**
     * Reconciles every tenant/provider pair for {@code settlementDate}: pairs with cash movement or an
     * imported statement always get a record, the remaining provider/tenant combinations only when the
     * provider reports a non-zero total.
     *
     * @throws ReconciliationException if another run is in progress
     */
    public ReconciliationRunResult reconcileAll(LocalDate settlementDate) {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Reconciliation already in progress, skipping this run");
            throw new ReconciliationException("Reconciliation already in progress");
        }

        ReconciliationRunResult result = ReconciliationRunResult.builder()
                .settlementDate(settlementDate)
                .startedAt(clock.instant())
                .build();
        runCounter.increment();
        log.info("Starting reconciliation for settlement date {}", settlementDate);

        try {
            return reconciliationTimer.record(() -> {
                for (CandidatePair pair : candidatePairs(settlementDate)) {
                    processPair(pair, settlementDate, result);
                }
                result.setCompletedAt(clock.instant());

                log.info("Reconciliation for {} completed. Pairs: {}, Matched: {}, Discrepancies: {}, " +
                                "Reports missing: {}, Resolved skipped: {}, Errors: {}",
                        settlementDate,
                        result.getPairsProcessed(),
                        result.getMatched(),
                        result.getDiscrepancies(),
                        result.getReportsMissing(),
                        result.getSkippedResolved(),
                        result.getErrors());
                return result;
            });
        } finally {
            isRunning.set(false);
        }
    }

    private Collection<CandidatePair> candidatePairs(LocalDate settlementDate) {
        Map<String, CandidatePair> pairs = new LinkedHashMap<>();
        List<Object[]> active = ledgerEntryRepository.findActiveCashAccounts(
                dayStart(settlementDate), dayStart(settlementDate.plusDays(1)));
        for (Object[] row : active) {
            String provider = ((String) row[1]).substring(LedgerService.CASH_PREFIX.length());
            addPair(pairs, new CandidatePair((String) row[0], provider, false));
        }
        for (SettlementStatement statement : statementRepository.findBySettlementDate(settlementDate)) {
            addPair(pairs, new CandidatePair(statement.getTenantId(), statement.getProvider(), false));
        }

        Set<String> tenants = new TreeSet<>(ledgerEntryRepository.findDistinctTenantIds());
        tenants.addAll(intentRepository.findDistinctTenantIds());
        Set<String> providers = new TreeSet<>(adapterRegistry.providerNames());
        for (String tenantId : tenants) {
            for (String provider : providers) {
                addPair(pairs, new CandidatePair(tenantId, provider, true));
            }
        }
        log.debug("Reconciliation for {} considers {} tenant/provider pairs", settlementDate, pairs.size());
        return pairs.values();
    }

    private static void addPair(Map<String, CandidatePair> pairs, CandidatePair pair) {
        pairs.putIfAbsent(pair.getTenantId() + "|" + pair.getProvider(), pair);
    }

    private void processPair(CandidatePair pair, LocalDate settlementDate, ReconciliationRunResult result) {
        String tenantId = pair.getTenantId();
        String provider = pair.getProvider();
        try {
            ReconciliationRecord record = reconcile(tenantId, provider, settlementDate, pair.isQuiet());
            if (record == null) {
                return;
            }
            result.incrementPairsProcessed();
            switch (record.getResolutionStatus()) {
                case MATCHED:
                    result.incrementMatched();
                    break;
                case PENDING:
                    result.incrementDiscrepancies();
                    break;
                case REPORT_MISSING:
                    result.incrementReportsMissing();
                    break;
                case RESOLVED:
                    result.incrementSkippedResolved();
                    break;
                default:
                    break;
            }
        } catch (RuntimeException e) {
            result.incrementPairsProcessed();
            log.error("Reconciliation failed for tenant={}, provider={}, date={}: {}",
                    tenantId, provider, settlementDate, e.getMessage(), e);
            result.addError(tenantId, provider, e.getMessage(), clock.instant());
        }
    }

    /**
     * Computes, stores and returns the record for one tenant, provider and UTC day. Rerunning
     * recomputes the same record; a RESOLVED record is returned unchanged.
     */
    @Transactional
    public ReconciliationRecord reconcile(String tenantId, String provider, LocalDate settlementDate) {
        return reconcile(tenantId, provider, settlementDate, false);
    }

    /**
     * @param skipIfEmpty return null instead of storing a first record when the day has no cash movement
     *                    and the provider reports nothing or zero
     */
    private ReconciliationRecord reconcile(String tenantId, String provider, LocalDate settlementDate,
                                           boolean skipIfEmpty) {
        Optional<ReconciliationRecord> existing =
                recordRepository.findByTenantIdAndProviderAndSettlementDate(tenantId, provider, settlementDate);
        if (existing.isPresent() && existing.get().getResolutionStatus() == ResolutionStatus.RESOLVED) {
            log.debug("Reconciliation record {} already resolved, not recomputed", existing.get().getId());
            return existing.get();
        }

        long expected = expectedTotal(tenantId, provider, settlementDate);
        OptionalLong reported = reportedTotal(tenantId, provider, settlementDate);
        if (skipIfEmpty && existing.isEmpty() && expected == 0
                && (reported.isEmpty() || reported.getAsLong() == 0)) {
            return null;
        }

        Instant now = clock.instant();
        ReconciliationRecord record = existing.orElseGet(() -> ReconciliationRecord.builder()
                .tenantId(tenantId)
                .provider(provider)
                .settlementDate(settlementDate)
                .createdAt(now)
                .build());
        record.setExpectedTotal(expected);
        record.setUpdatedAt(now);

        if (reported.isEmpty()) {
            record.setReportedTotal(null);
            record.setDiscrepancy(expected);
            record.setResolutionStatus(ResolutionStatus.REPORT_MISSING);
            reportMissingCounter.increment();
            log.warn("No settlement report for tenant={}, provider={}, date={}; expected {}",
                    tenantId, provider, settlementDate, expected);
        } else {
            long discrepancy = expected - reported.getAsLong();
            record.setReportedTotal(reported.getAsLong());
            record.setDiscrepancy(discrepancy);
            if (discrepancy == 0) {
                record.setResolutionStatus(ResolutionStatus.MATCHED);
                matchedCounter.increment();
                log.info("Reconciled tenant={}, provider={}, date={}: {} matched",
                        tenantId, provider, settlementDate, expected);
            } else {
                record.setResolutionStatus(ResolutionStatus.PENDING);
                discrepancyCounter.increment();
                log.warn("Discrepancy for tenant={}, provider={}, date={}: expected={}, reported={}, discrepancy={}",
                        tenantId, provider, settlementDate, expected, reported.getAsLong(), discrepancy);
            }
        }
        return recordRepository.save(record);
    }

    /**
     * Net movement of {@code cash:<provider>} over the UTC day.
     */
    long expectedTotal(String tenantId, String provider, LocalDate settlementDate) {
        return ledgerService.netMovement(tenantId, LedgerService.cashAccount(provider),
                dayStart(settlementDate), dayStart(settlementDate.plusDays(1)));
    }

    private OptionalLong reportedTotal(String tenantId, String provider, LocalDate settlementDate) {
        try {
            OptionalLong fromProvider = adapterRegistry.find(provider)
                    .map(adapter -> adapter.settlementReport(tenantId, settlementDate))
                    .orElse(OptionalLong.empty());
            if (fromProvider.isPresent()) {
                return fromProvider;
            }
        } catch (ProviderUnavailableException | ProviderRejectedException e) {
            providerErrorCounter.increment();
            log.warn("Settlement report unavailable from {} for tenant={}, date={}: {}; falling back to statements",
                    provider, tenantId, settlementDate, e.getMessage());
        }

        return statementRepository.findByTenantIdAndProviderAndSettlementDate(tenantId, provider, settlementDate)
                .map(statement -> OptionalLong.of(statement.getReportedTotal()))
                .orElse(OptionalLong.empty());
    }

    /**
     * Operator resolution of a discrepancy. The ledger is not touched.
     */
    @Transactional
    public ReconciliationRecord resolve(Long recordId, String note) {
        ReconciliationRecord record = recordRepository.findById(recordId)
                .orElseThrow(() -> new ResourceNotFoundException("Reconciliation record", recordId));
        if (record.getResolutionStatus() == ResolutionStatus.MATCHED) {
            throw new InvalidStateTransitionException("Reconciliation record " + recordId + " is already matched");
        }
        record.setResolutionStatus(ResolutionStatus.RESOLVED);
        record.setResolutionNote(note);
        record.setUpdatedAt(clock.instant());
        log.info("Reconciliation record {} resolved (discrepancy={}): {}", recordId, record.getDiscrepancy(), note);
        return recordRepository.save(record);
    }

    /**
     * Records a provider statement total. A later import for the same day replaces the earlier one.
     */
    @Transactional
    public SettlementStatement importStatement(String tenantId, StatementImportRequest request) {
        String provider = request.getProvider().toLowerCase();
        SettlementStatement statement = statementRepository
                .findByTenantIdAndProviderAndSettlementDate(tenantId, provider, request.getSettlementDate())
                .orElseGet(() -> SettlementStatement.builder()
                        .tenantId(tenantId)
                        .provider(provider)
                        .settlementDate(request.getSettlementDate())
                        .build());
        statement.setReportedTotal(request.getReportedTotal());
        statement.setSourceReference(request.getSourceReference());
        statement.setImportedAt(clock.instant());
        log.info("Imported settlement statement: tenant={}, provider={}, date={}, total={}",
                tenantId, provider, request.getSettlementDate(), request.getReportedTotal());
        return statementRepository.save(statement);
    }

    @Transactional(readOnly = true)
    public Page<ReconciliationRecord> listRecords(ResolutionStatus status, Pageable pageable) {
        if (status == null) {
            return recordRepository.findAll(pageable);
        }
        return recordRepository.findByResolutionStatus(status, pageable);
    }

    /**
     * Get current reconciliation statistics.
     * Useful for monitoring dashboards.
     */
    public ReconciliationStats getStats() {
        return ReconciliationStats.builder()
                .matchedCount(recordRepository.countByResolutionStatus(ResolutionStatus.MATCHED))
                .pendingCount(recordRepository.countByResolutionStatus(ResolutionStatus.PENDING))
                .reportMissingCount(recordRepository.countByResolutionStatus(ResolutionStatus.REPORT_MISSING))
                .resolvedCount(recordRepository.countByResolutionStatus(ResolutionStatus.RESOLVED))
                .isReconciliationRunning(isRunning.get())
                .build();
    }

    private static Instant dayStart(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    @Value
    private static class CandidatePair {
        String tenantId;
        String provider;
        // only a provider/tenant combination, no movement or statement behind it
        boolean quiet;
    }

    @Data
    @Builder
    public static class ReconciliationStats {
        private long matchedCount;
        private long pendingCount;
        private long reportMissingCount;
        private long resolvedCount;
        private boolean isReconciliationRunning;
    }
}
