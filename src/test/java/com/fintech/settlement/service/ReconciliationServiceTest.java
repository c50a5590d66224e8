package com.fintech.settlement.service;

import com.fintech.settlement.dto.ReconciliationRunResult;
import com.fintech.settlement.dto.StatementImportRequest;
import com.fintech.settlement.entity.ReconciliationRecord;
import com.fintech.settlement.entity.ResolutionStatus;
import com.fintech.settlement.entity.SettlementStatement;
import com.fintech.settlement.exception.InvalidStateTransitionException;
import com.fintech.settlement.exception.ProviderUnavailableException;
import com.fintech.settlement.provider.PaymentProviderAdapter;
import com.fintech.settlement.provider.ProviderAdapterRegistry;
import com.fintech.settlement.repository.LedgerEntryRepository;
import com.fintech.settlement.repository.PaymentIntentRepository;
import com.fintech.settlement.repository.ReconciliationRecordRepository;
import com.fintech.settlement.repository.SettlementStatementRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReconciliationService.
 * <p>
 * Amounts are minor units: 1_000_000 is KES 10,000.
 */
@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

    private static final String TENANT = "tenant-a";
    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);
    private static final Instant DAY_START = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant NEXT_DAY_START = Instant.parse("2024-03-02T00:00:00Z");

    @Mock
    private LedgerService ledgerService;

    @Mock
    private LedgerEntryRepository ledgerEntryRepository;

    @Mock
    private PaymentIntentRepository intentRepository;

    @Mock
    private ReconciliationRecordRepository recordRepository;

    @Mock
    private SettlementStatementRepository statementRepository;

    @Mock
    private PaymentProviderAdapter adapter;

    private SimpleMeterRegistry meterRegistry;
    private ReconciliationService reconciliationService;

    @BeforeEach
    void setUp() {
        when(adapter.getProviderName()).thenReturn("mpesa");
        meterRegistry = new SimpleMeterRegistry();
        reconciliationService = new ReconciliationService(
                ledgerService,
                ledgerEntryRepository,
                intentRepository,
                recordRepository,
                statementRepository,
                new ProviderAdapterRegistry(List.of(adapter)),
                Clock.fixed(Instant.parse("2024-03-02T02:00:00Z"), ZoneOffset.UTC),
                meterRegistry
        );
        reconciliationService.initMetrics();
    }

    private void givenCashMovement(long movement) {
        when(ledgerService.netMovement(TENANT, "cash:mpesa", DAY_START, NEXT_DAY_START)).thenReturn(movement);
    }

    private void givenKnownPairs(List<Object[]> active, List<SettlementStatement> statements, List<String> tenants) {
        when(ledgerEntryRepository.findActiveCashAccounts(DAY_START, NEXT_DAY_START)).thenReturn(active);
        when(statementRepository.findBySettlementDate(DAY)).thenReturn(statements);
        when(ledgerEntryRepository.findDistinctTenantIds()).thenReturn(tenants);
        when(intentRepository.findDistinctTenantIds()).thenReturn(List.of());
    }

    private void givenStatement(long reportedTotal) {
        when(statementRepository.findByTenantIdAndProviderAndSettlementDate(TENANT, "mpesa", DAY))
                .thenReturn(Optional.of(SettlementStatement.builder()
                        .tenantId(TENANT)
                        .provider("mpesa")
                        .settlementDate(DAY)
                        .reportedTotal(reportedTotal)
                        .build()));
    }

    private void saveReturnsArgument() {
        when(recordRepository.save(any(ReconciliationRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Nested
    @DisplayName("Record Computation Tests")
    class ComputationTests {

        @Test
        @DisplayName("Should flag a shortfall as a PENDING discrepancy")
        void shouldFlagDiscrepancy() {
            // Given
            givenCashMovement(1_000_000L);
            givenStatement(950_000L);
            saveReturnsArgument();

            // When
            ReconciliationRecord record = reconciliationService.reconcile(TENANT, "mpesa", DAY);

            // Then
            assertThat(record.getExpectedTotal()).isEqualTo(1_000_000L);
            assertThat(record.getReportedTotal()).isEqualTo(950_000L);
            assertThat(record.getDiscrepancy()).isEqualTo(50_000L);
            assertThat(record.getResolutionStatus()).isEqualTo(ResolutionStatus.PENDING);
            assertThat(meterRegistry.counter("reconciliation.records.discrepancy").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should match when the provider report equals the ledger movement")
        void shouldMatchProviderReport() {
            // Given
            givenCashMovement(1_000_000L);
            when(adapter.settlementReport(TENANT, DAY)).thenReturn(OptionalLong.of(1_000_000L));
            saveReturnsArgument();

            // When
            ReconciliationRecord record = reconciliationService.reconcile(TENANT, "mpesa", DAY);

            // Then
            assertThat(record.getResolutionStatus()).isEqualTo(ResolutionStatus.MATCHED);
            assertThat(record.getDiscrepancy()).isZero();
            verifyNoInteractions(statementRepository);
        }

        @Test
        @DisplayName("Should mark REPORT_MISSING when neither a report nor a statement exists")
        void shouldMarkReportMissing() {
            // Given
            givenCashMovement(300_000L);
            when(statementRepository.findByTenantIdAndProviderAndSettlementDate(TENANT, "mpesa", DAY))
                    .thenReturn(Optional.empty());
            saveReturnsArgument();

            // When
            ReconciliationRecord record = reconciliationService.reconcile(TENANT, "mpesa", DAY);

            // Then
            assertThat(record.getResolutionStatus()).isEqualTo(ResolutionStatus.REPORT_MISSING);
            assertThat(record.getReportedTotal()).isNull();
            assertThat(record.getDiscrepancy()).isEqualTo(300_000L);
        }

        @Test
        @DisplayName("Should fall back to the imported statement when the provider report fails")
        void shouldFallBackToStatement() {
            // Given
            givenCashMovement(500_000L);
            when(adapter.settlementReport(TENANT, DAY))
                    .thenThrow(new ProviderUnavailableException("timeout", "mpesa"));
            givenStatement(500_000L);
            saveReturnsArgument();

            // When
            ReconciliationRecord record = reconciliationService.reconcile(TENANT, "mpesa", DAY);

            // Then
            assertThat(record.getResolutionStatus()).isEqualTo(ResolutionStatus.MATCHED);
            assertThat(meterRegistry.counter("reconciliation.provider.errors").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should recompute the existing record in place on rerun")
        void shouldUpdateExistingRecord() {
            // Given
            ReconciliationRecord existing = ReconciliationRecord.builder()
                    .id(9L)
                    .tenantId(TENANT)
                    .provider("mpesa")
                    .settlementDate(DAY)
                    .expectedTotal(1_000_000L)
                    .reportedTotal(null)
                    .discrepancy(1_000_000L)
                    .resolutionStatus(ResolutionStatus.REPORT_MISSING)
                    .build();
            when(recordRepository.findByTenantIdAndProviderAndSettlementDate(TENANT, "mpesa", DAY))
                    .thenReturn(Optional.of(existing));
            givenCashMovement(1_000_000L);
            givenStatement(1_000_000L);
            saveReturnsArgument();

            // When
            ReconciliationRecord record = reconciliationService.reconcile(TENANT, "mpesa", DAY);

            // Then
            assertThat(record.getId()).isEqualTo(9L);
            assertThat(record.getResolutionStatus()).isEqualTo(ResolutionStatus.MATCHED);
        }

        @Test
        @DisplayName("Should leave a RESOLVED record untouched")
        void shouldKeepResolvedRecord() {
            // Given
            ReconciliationRecord resolved = ReconciliationRecord.builder()
                    .id(9L)
                    .resolutionStatus(ResolutionStatus.RESOLVED)
                    .resolutionNote("bank fee")
                    .build();
            when(recordRepository.findByTenantIdAndProviderAndSettlementDate(TENANT, "mpesa", DAY))
                    .thenReturn(Optional.of(resolved));

            // When
            ReconciliationRecord record = reconciliationService.reconcile(TENANT, "mpesa", DAY);

            // Then
            assertThat(record).isSameAs(resolved);
            verifyNoInteractions(ledgerService);
            verify(recordRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Batch Run Tests")
    class BatchTests {

        @Test
        @DisplayName("Should reconcile every active pair and record errors without aborting")
        void shouldContinueAfterPairFailure() {
            // Given
            givenKnownPairs(
                    List.of(new Object[]{"tenant-b", "cash:mpesa"}, new Object[]{TENANT, "cash:mpesa"}),
                    List.of(),
                    List.of("tenant-b", TENANT));
            when(recordRepository.findByTenantIdAndProviderAndSettlementDate(anyString(), eq("mpesa"), eq(DAY)))
                    .thenReturn(Optional.empty());
            when(ledgerService.netMovement(eq("tenant-b"), eq("cash:mpesa"), any(Instant.class), any(Instant.class)))
                    .thenThrow(new IllegalStateException("database unavailable"));
            givenCashMovement(0L);
            when(statementRepository.findByTenantIdAndProviderAndSettlementDate(TENANT, "mpesa", DAY))
                    .thenReturn(Optional.empty());
            saveReturnsArgument();

            // When
            ReconciliationRunResult result = reconciliationService.reconcileAll(DAY);

            // Then
            assertThat(result.getPairsProcessed()).isEqualTo(2);
            assertThat(result.getErrors()).isEqualTo(1);
            assertThat(result.getErrorDetails().get(0).getTenantId()).isEqualTo("tenant-b");
            assertThat(result.getReportsMissing()).isEqualTo(1);
            assertThat(result.getCompletedAt()).isNotNull();
            assertThat(reconciliationService.getStats().isReconciliationRunning()).isFalse();
        }

        @Test
        @DisplayName("Should flag money the provider settled on a day the ledger saw no movement")
        void shouldReconcileProviderWithoutLedgerMovement() {
            // Given
            givenKnownPairs(List.of(), List.of(), List.of(TENANT));
            when(recordRepository.findByTenantIdAndProviderAndSettlementDate(TENANT, "mpesa", DAY))
                    .thenReturn(Optional.empty());
            givenCashMovement(0L);
            when(adapter.settlementReport(TENANT, DAY)).thenReturn(OptionalLong.of(500_000L));
            saveReturnsArgument();

            // When
            ReconciliationRunResult result = reconciliationService.reconcileAll(DAY);

            // Then
            assertThat(result.getPairsProcessed()).isEqualTo(1);
            assertThat(result.getDiscrepancies()).isEqualTo(1);
            ArgumentCaptor<ReconciliationRecord> captor = ArgumentCaptor.forClass(ReconciliationRecord.class);
            verify(recordRepository).save(captor.capture());
            assertThat(captor.getValue().getResolutionStatus()).isEqualTo(ResolutionStatus.PENDING);
            assertThat(captor.getValue().getDiscrepancy()).isEqualTo(-500_000L);
        }

        @Test
        @DisplayName("Should reconcile a pair known only from an imported statement")
        void shouldReconcileStatementOnlyPair() {
            // Given
            SettlementStatement statement = SettlementStatement.builder()
                    .tenantId("tenant-c")
                    .provider("airtel")
                    .settlementDate(DAY)
                    .reportedTotal(120_000L)
                    .build();
            givenKnownPairs(List.of(), List.of(statement), List.of());
            when(recordRepository.findByTenantIdAndProviderAndSettlementDate("tenant-c", "airtel", DAY))
                    .thenReturn(Optional.empty());
            when(ledgerService.netMovement("tenant-c", "cash:airtel", DAY_START, NEXT_DAY_START)).thenReturn(0L);
            when(statementRepository.findByTenantIdAndProviderAndSettlementDate("tenant-c", "airtel", DAY))
                    .thenReturn(Optional.of(statement));
            saveReturnsArgument();

            // When
            ReconciliationRunResult result = reconciliationService.reconcileAll(DAY);

            // Then
            assertThat(result.getPairsProcessed()).isEqualTo(1);
            assertThat(result.getDiscrepancies()).isEqualTo(1);
            verify(recordRepository).save(argThat(record -> record.getDiscrepancy() == -120_000L));
        }

        @Test
        @DisplayName("Should leave no record for a known tenant with nothing on either side")
        void shouldSkipEmptyProviderPair() {
            // Given
            givenKnownPairs(List.of(), List.of(), List.of(TENANT));
            when(recordRepository.findByTenantIdAndProviderAndSettlementDate(TENANT, "mpesa", DAY))
                    .thenReturn(Optional.empty());
            givenCashMovement(0L);
            when(statementRepository.findByTenantIdAndProviderAndSettlementDate(TENANT, "mpesa", DAY))
                    .thenReturn(Optional.empty());

            // When
            ReconciliationRunResult result = reconciliationService.reconcileAll(DAY);

            // Then
            assertThat(result.getPairsProcessed()).isZero();
            verify(recordRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Resolution Tests")
    class ResolutionTests {

        @Test
        @DisplayName("Should resolve a pending discrepancy with the operator note")
        void shouldResolve() {
            // Given
            ReconciliationRecord record = ReconciliationRecord.builder()
                    .id(4L)
                    .discrepancy(50_000L)
                    .resolutionStatus(ResolutionStatus.PENDING)
                    .build();
            when(recordRepository.findById(4L)).thenReturn(Optional.of(record));
            saveReturnsArgument();

            // When
            ReconciliationRecord resolved = reconciliationService.resolve(4L, "Provider fee deducted");

            // Then
            assertThat(resolved.getResolutionStatus()).isEqualTo(ResolutionStatus.RESOLVED);
            assertThat(resolved.getResolutionNote()).isEqualTo("Provider fee deducted");
            assertThat(resolved.getDiscrepancy()).isEqualTo(50_000L);
            verifyNoInteractions(ledgerService);
        }

        @Test
        @DisplayName("Should refuse to resolve a matched record")
        void shouldRefuseMatched() {
            // Given
            when(recordRepository.findById(4L)).thenReturn(Optional.of(ReconciliationRecord.builder()
                    .id(4L)
                    .resolutionStatus(ResolutionStatus.MATCHED)
                    .build()));

            // When/Then
            assertThatThrownBy(() -> reconciliationService.resolve(4L, "n/a"))
                    .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("Should replace the total of a re-imported statement")
        void shouldUpsertStatement() {
            // Given
            givenStatement(900_000L);
            when(statementRepository.save(any(SettlementStatement.class)))
                    .thenAnswer(invocation -> invocation.getArgument(0));
            StatementImportRequest request = StatementImportRequest.builder()
                    .provider("MPESA")
                    .settlementDate(DAY)
                    .reportedTotal(950_000L)
                    .sourceReference("stmt-2024-03-01.csv")
                    .build();

            // When
            SettlementStatement statement = reconciliationService.importStatement(TENANT, request);

            // Then
            assertThat(statement.getReportedTotal()).isEqualTo(950_000L);
            assertThat(statement.getSourceReference()).isEqualTo("stmt-2024-03-01.csv");
            assertThat(statement.getImportedAt()).isEqualTo(Instant.parse("2024-03-02T02:00:00Z"));
        }
    }
}
