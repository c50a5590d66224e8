package com.fintech.settlement.service;

import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.dto.LedgerLine;
import com.fintech.settlement.entity.LedgerEntry;
import com.fintech.settlement.entity.Payment;
import com.fintech.settlement.entity.PaymentIntent;
import com.fintech.settlement.entity.PaymentPurpose;
import com.fintech.settlement.exception.DuplicateReferenceException;
import com.fintech.settlement.exception.ResourceNotFoundException;
import com.fintech.settlement.exception.UnbalancedTransactionException;
import com.fintech.settlement.repository.LedgerEntryRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LedgerService.
 * <p>
 * Tests cover:
 * - Balance validation of transaction groups
 * - Duplicate group detection
 * - Settlement and reversal postings
 * - Natural balances per account type
 */
@ExtendWith(MockitoExtension.class)
class LedgerServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private LedgerEntryRepository ledgerEntryRepository;

    private SettlementProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private LedgerService ledgerService;

    @BeforeEach
    void setUp() {
        properties = new SettlementProperties();
        meterRegistry = new SimpleMeterRegistry();
        ledgerService = new LedgerService(
                ledgerEntryRepository,
                new FlatRateTaxPolicy(properties),
                properties,
                Clock.fixed(NOW, ZoneOffset.UTC),
                meterRegistry
        );
        ledgerService.initMetrics();
    }

    @Nested
    @DisplayName("Append Validation Tests")
    class AppendValidationTests {

        @Test
        @DisplayName("Should reject a group whose debits and credits differ")
        void shouldRejectUnbalancedGroup() {
            // Given
            List<LedgerLine> lines = List.of(
                    LedgerLine.debit("cash:mpesa", 1000),
                    LedgerLine.credit("revenue:payments", 900));

            // When / Then
            assertThatThrownBy(() -> ledgerService.append("settle:1", "t1", "payment:1", lines))
                    .isInstanceOf(UnbalancedTransactionException.class)
                    .hasMessageContaining("debits=1000")
                    .hasMessageContaining("credits=900");
            verify(ledgerEntryRepository, never()).saveAllAndFlush(anyList());
            assertThat(meterRegistry.counter("ledger.invariant.violations").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject a line carrying both a debit and a credit")
        void shouldRejectLineWithBothSides() {
            // Given
            List<LedgerLine> lines = List.of(
                    new LedgerLine("cash:mpesa", 500, 500),
                    LedgerLine.debit("cash:airtel", 100),
                    LedgerLine.credit("revenue:payments", 100));

            // When / Then
            assertThatThrownBy(() -> ledgerService.append("settle:2", "t1", "payment:2", lines))
                    .isInstanceOf(UnbalancedTransactionException.class);
        }

        @Test
        @DisplayName("Should reject an empty group")
        void shouldRejectEmptyGroup() {
            assertThatThrownBy(() -> ledgerService.append("settle:3", "t1", "payment:3", List.of()))
                    .isInstanceOf(UnbalancedTransactionException.class)
                    .hasMessageContaining("no lines");
        }

        @Test
        @DisplayName("Should reject a group id that was already posted")
        void shouldRejectDuplicateGroup() {
            // Given
            when(ledgerEntryRepository.existsByTransactionGroupId("settle:4")).thenReturn(true);

            // When / Then
            assertThatThrownBy(() -> ledgerService.append("settle:4", "t1", "payment:4", List.of(
                    LedgerLine.debit("cash:mpesa", 100),
                    LedgerLine.credit("revenue:payments", 100))))
                    .isInstanceOf(DuplicateReferenceException.class);
            verify(ledgerEntryRepository, never()).saveAllAndFlush(anyList());
        }

        @Test
        @DisplayName("Should translate a unique constraint race into a duplicate reference")
        void shouldTranslateConstraintViolation() {
            // Given
            when(ledgerEntryRepository.saveAllAndFlush(anyList()))
                    .thenThrow(new DataIntegrityViolationException("uk_ledger_group_line"));

            // When / Then
            assertThatThrownBy(() -> ledgerService.append("settle:5", "t1", "payment:5", List.of(
                    LedgerLine.debit("cash:mpesa", 100),
                    LedgerLine.credit("revenue:payments", 100))))
                    .isInstanceOf(DuplicateReferenceException.class);
        }
    }

    @Nested
    @DisplayName("Posting Tests")
    class PostingTests {

        @Test
        @DisplayName("Should post cash against revenue for a confirmed payment")
        void shouldPostSettlement() {
            // Given
            when(ledgerEntryRepository.saveAllAndFlush(anyList()))
                    .thenAnswer(invocation -> invocation.getArgument(0));
            Payment payment = Payment.builder().id(7L).provider("mpesa").build();
            PaymentIntent intent = PaymentIntent.builder()
                    .id(3L).tenantId("t1").purpose(PaymentPurpose.ONE_OFF).build();

            // When
            List<LedgerEntry> entries = ledgerService.postSettlement(payment, intent, 50_000);

            // Then
            assertThat(entries).hasSize(2);
            assertThat(entries.get(0).getAccount()).isEqualTo("cash:mpesa");
            assertThat(entries.get(0).getDebitAmount()).isEqualTo(50_000);
            assertThat(entries.get(1).getAccount()).isEqualTo("revenue:payments");
            assertThat(entries.get(1).getCreditAmount()).isEqualTo(50_000);
            assertThat(entries).allSatisfy(entry -> {
                assertThat(entry.getTransactionGroupId()).isEqualTo("settle:7");
                assertThat(entry.getReference()).isEqualTo("payment:7");
                assertThat(entry.getCurrency()).isEqualTo("KES");
                assertThat(entry.getCreatedAt()).isEqualTo(NOW);
            });
        }

        @Test
        @DisplayName("Should split out the tax share when a rate is configured")
        void shouldSplitTax() {
            // Given
            properties.getTax().setRate(new BigDecimal("0.16"));
            when(ledgerEntryRepository.saveAllAndFlush(anyList()))
                    .thenAnswer(invocation -> invocation.getArgument(0));
            Payment payment = Payment.builder().id(8L).provider("airtel").build();
            PaymentIntent intent = PaymentIntent.builder()
                    .id(4L).tenantId("t1").purpose(PaymentPurpose.SUBSCRIPTION_RENEWAL).build();

            // When
            List<LedgerEntry> entries = ledgerService.postSettlement(payment, intent, 11_600);

            // Then
            assertThat(entries).extracting(LedgerEntry::getAccount)
                    .containsExactly("cash:airtel", "revenue:subscriptions", "payable:tax");
            assertThat(entries).extracting(LedgerEntry::getCreditAmount)
                    .containsExactly(0L, 10_000L, 1_600L);
        }

        @Test
        @DisplayName("Should mirror every line of the original group on reversal")
        void shouldMirrorOnReversal() {
            // Given
            List<LedgerEntry> original = List.of(
                    LedgerEntry.builder().transactionGroupId("settle:9").lineNumber(1).tenantId("t1")
                            .account("cash:mpesa").debitAmount(2_000).creditAmount(0).build(),
                    LedgerEntry.builder().transactionGroupId("settle:9").lineNumber(2).tenantId("t1")
                            .account("revenue:payments").debitAmount(0).creditAmount(2_000).build());
            when(ledgerEntryRepository.findByTransactionGroupIdOrderByLineNumberAsc("settle:9")).thenReturn(original);
            when(ledgerEntryRepository.saveAllAndFlush(anyList()))
                    .thenAnswer(invocation -> invocation.getArgument(0));

            // When
            List<LedgerEntry> reversal = ledgerService.postReversal("settle:9", "reverse:9", "refund:5");

            // Then
            assertThat(reversal).hasSize(2);
            assertThat(reversal.get(0).getAccount()).isEqualTo("cash:mpesa");
            assertThat(reversal.get(0).getCreditAmount()).isEqualTo(2_000);
            assertThat(reversal.get(1).getDebitAmount()).isEqualTo(2_000);
            assertThat(reversal).allSatisfy(entry -> {
                assertThat(entry.getReversesGroupId()).isEqualTo("settle:9");
                assertThat(entry.getTransactionGroupId()).isEqualTo("reverse:9");
            });
        }

        @Test
        @DisplayName("Should refuse to reverse a group that does not exist")
        void shouldRefuseUnknownReversal() {
            when(ledgerEntryRepository.findByTransactionGroupIdOrderByLineNumberAsc("settle:404")).thenReturn(List.of());

            assertThatThrownBy(() -> ledgerService.postReversal("settle:404", "reverse:404", "refund:1"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Balance Tests")
    class BalanceTests {

        @Test
        @DisplayName("Cash accounts are debit-normal")
        void cashIsDebitNormal() {
            // Given
            when(ledgerEntryRepository.sumDebits("t1", "cash:mpesa", NOW)).thenReturn(10_000L);
            when(ledgerEntryRepository.sumCredits("t1", "cash:mpesa", NOW)).thenReturn(2_500L);

            // When / Then
            assertThat(ledgerService.balanceOf("t1", "cash:mpesa", NOW)).isEqualTo(7_500);
        }

        @Test
        @DisplayName("Revenue accounts are credit-normal")
        void revenueIsCreditNormal() {
            // Given
            when(ledgerEntryRepository.sumDebits("t1", "revenue:payments", NOW)).thenReturn(2_500L);
            when(ledgerEntryRepository.sumCredits("t1", "revenue:payments", NOW)).thenReturn(10_000L);

            // When / Then
            assertThat(ledgerService.balanceOf("t1", "revenue:payments", NOW)).isEqualTo(7_500);
        }

        @Test
        @DisplayName("Day movement is summed over a half-open window")
        void dayMovementUsesHalfOpenWindow() {
            // Given
            Instant dayStart = Instant.parse("2024-03-01T00:00:00Z");
            Instant nextDayStart = Instant.parse("2024-03-02T00:00:00Z");
            when(ledgerEntryRepository.sumDebitsBetween("t1", "cash:mpesa", dayStart, nextDayStart)).thenReturn(9_000L);
            when(ledgerEntryRepository.sumCreditsBetween("t1", "cash:mpesa", dayStart, nextDayStart)).thenReturn(1_000L);

            // When / Then
            assertThat(ledgerService.netMovement("t1", "cash:mpesa", dayStart, nextDayStart)).isEqualTo(8_000);
            verify(ledgerEntryRepository, never()).sumDebits(anyString(), anyString(), any(Instant.class));
        }
    }

    @Test
    @DisplayName("Should capture the posted lines in order with line numbers")
    @SuppressWarnings("unchecked")
    void shouldNumberLines() {
        // Given
        when(ledgerEntryRepository.saveAllAndFlush(anyList()))
                .thenAnswer(invocation -> invocation.getArgument(0));

        // When
        ledgerService.append("manual:1", "t1", "adjustment:1", List.of(
                LedgerLine.debit("cash:mpesa", 300),
                LedgerLine.credit("revenue:payments", 200),
                LedgerLine.credit("payable:tax", 100)));

        // Then
        ArgumentCaptor<List<LedgerEntry>> captor = ArgumentCaptor.forClass(List.class);
        verify(ledgerEntryRepository).saveAllAndFlush(captor.capture());
        assertThat(captor.getValue()).extracting(LedgerEntry::getLineNumber).containsExactly(1, 2, 3);
        assertThat(meterRegistry.counter("ledger.groups.posted").count()).isEqualTo(1.0);
    }
}
