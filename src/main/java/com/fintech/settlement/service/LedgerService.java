package com.fintech.settlement.service;

import com.fintech.settlement.config.SettlementProperties;
import com.fintech.settlement.dto.LedgerLine;
import com.fintech.settlement.entity.LedgerEntry;
import com.fintech.settlement.entity.Payment;
import com.fintech.settlement.entity.PaymentIntent;
import com.fintech.settlement.exception.DuplicateReferenceException;
import com.fintech.settlement.exception.LedgerInvariantException;
import com.fintech.settlement.exception.ResourceNotFoundException;
import com.fintech.settlement.exception.UnbalancedTransactionException;
import com.fintech.settlement.repository.LedgerEntryRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only double-entry journal.
 * <p>
 * Chart of accounts:
 * <pre>
 *   cash:&lt;provider&gt;        money held at a provider (debit-normal)
 *   revenue:payments       one-off payments
 *   revenue:subscriptions  subscription renewals
 *   payable:tax            tax share of settled amounts
 * </pre>
 * Settlement of payment P:
 * <pre>
 *   group settle:P   DR cash:&lt;provider&gt;  amount
 *                    CR revenue:...       amount - tax
 *                    CR payable:tax       tax (only when non-zero)
 * </pre>
 * A refund posts the mirror image as group reverse:P. Rows are never updated or deleted.
 */
@Service
@Slf4j
public class LedgerService {

    public static final String CASH_PREFIX = "cash:";
    public static final String RECEIVABLE_PREFIX = "receivable:";
    public static final String TAX_PAYABLE_ACCOUNT = "payable:tax";

    private final LedgerEntryRepository ledgerEntryRepository;
    private final TaxPolicy taxPolicy;
    private final SettlementProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private Counter groupsPostedCounter;
    private Counter invariantViolationCounter;

    public LedgerService(LedgerEntryRepository ledgerEntryRepository,
                         TaxPolicy taxPolicy,
                         SettlementProperties properties,
                         Clock clock,
                         MeterRegistry meterRegistry) {
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.taxPolicy = taxPolicy;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        groupsPostedCounter = Counter.builder("ledger.groups.posted")
                .description("Balanced transaction groups appended to the journal")
                .register(meterRegistry);

        invariantViolationCounter = Counter.builder("ledger.invariant.violations")
                .description("Postings refused because they would break a ledger invariant")
                .register(meterRegistry);
    }

    public static String settlementGroup(Long paymentId) {
        return "settle:" + paymentId;
    }

    public static String reversalGroup(Long paymentId) {
        return "reverse:" + paymentId;
    }

    public static String paymentReference(Long paymentId) {
        return "payment:" + paymentId;
    }

    public static String cashAccount(String provider) {
        return CASH_PREFIX + provider;
    }

    /**
     * Appends one balanced transaction group. Joins the caller's transaction so the journal lines
     * commit together with the state change that caused them.
     *
     * @throws UnbalancedTransactionException if debits and credits differ, a line sets both or neither
     *                                        side, or there are no lines
     * @throws DuplicateReferenceException    if the group, or the reference within it, was already posted
     */
    @Transactional
    public List<LedgerEntry> append(String transactionGroupId, String tenantId, String reference,
                                    List<LedgerLine> lines) {
        return append(transactionGroupId, tenantId, reference, lines, null);
    }

    private List<LedgerEntry> append(String transactionGroupId, String tenantId, String reference,
                                     List<LedgerLine> lines, String reversesGroupId) {
        validateBalanced(transactionGroupId, lines);

        if (ledgerEntryRepository.existsByTransactionGroupId(transactionGroupId)
                || ledgerEntryRepository.existsByReferenceAndTransactionGroupId(reference, transactionGroupId)) {
            throw violation(new DuplicateReferenceException(
                    "Transaction group " + transactionGroupId + " already posted", transactionGroupId, reference));
        }

        Instant now = clock.instant();
        List<LedgerEntry> entries = new ArrayList<>(lines.size());
        int lineNumber = 1;
        for (LedgerLine line : lines) {
            entries.add(LedgerEntry.builder()
                    .transactionGroupId(transactionGroupId)
                    .lineNumber(lineNumber++)
                    .tenantId(tenantId)
                    .account(line.getAccount())
                    .debitAmount(line.getDebit())
                    .creditAmount(line.getCredit())
                    .currency(properties.getCurrency())
                    .reference(reference)
                    .reversesGroupId(reversesGroupId)
                    .createdAt(now)
                    .build());
        }

        List<LedgerEntry> saved;
        try {
            saved = ledgerEntryRepository.saveAllAndFlush(entries);
        } catch (DataIntegrityViolationException e) {
            // a concurrent writer posted the same group between the check and the insert
            throw violation(new DuplicateReferenceException(
                    "Transaction group " + transactionGroupId + " already posted", transactionGroupId, reference));
        }

        groupsPostedCounter.increment();
        log.info("Posted ledger group={}, tenant={}, reference={}, lines={}",
                transactionGroupId, tenantId, reference, saved.size());
        return saved;
    }

    /**
     * Books a confirmed collection: cash in at the provider against revenue and tax payable.
     */
    @Transactional
    public List<LedgerEntry> postSettlement(Payment payment, PaymentIntent intent, long amount) {
        String revenueAccount = intent.getPurpose().getRevenueAccount();
        if (revenueAccount == null) {
            throw new IllegalArgumentException("Intent " + intent.getId() + " with purpose "
                    + intent.getPurpose() + " cannot be settled as revenue");
        }

        long tax = taxPolicy.taxOn(intent.getTenantId(), amount);
        List<LedgerLine> lines = new ArrayList<>();
        lines.add(LedgerLine.debit(cashAccount(payment.getProvider()), amount));
        lines.add(LedgerLine.credit(revenueAccount, amount - tax));
        if (tax > 0) {
            lines.add(LedgerLine.credit(TAX_PAYABLE_ACCOUNT, tax));
        }

        return append(settlementGroup(payment.getId()), intent.getTenantId(),
                paymentReference(payment.getId()), lines);
    }

    /**
     * Posts the mirror image of an existing group. The original group is left untouched.
     */
    @Transactional
    public List<LedgerEntry> postReversal(String originalGroupId, String reversalGroupId, String reference) {
        List<LedgerEntry> original = ledgerEntryRepository.findByTransactionGroupIdOrderByLineNumberAsc(originalGroupId);
        if (original.isEmpty()) {
            throw new ResourceNotFoundException("Ledger transaction group", originalGroupId);
        }

        List<LedgerLine> mirrored = new ArrayList<>(original.size());
        for (LedgerEntry entry : original) {
            mirrored.add(new LedgerLine(entry.getAccount(), entry.getCreditAmount(), entry.getDebitAmount()));
        }
        return append(reversalGroupId, original.get(0).getTenantId(), reference, mirrored, originalGroupId);
    }

    /**
     * Natural balance of an account over all entries created up to and including {@code asOf}.
     */
    @Transactional(readOnly = true)
    public long balanceOf(String tenantId, String account, Instant asOf) {
        long debits = ledgerEntryRepository.sumDebits(tenantId, account, asOf);
        long credits = ledgerEntryRepository.sumCredits(tenantId, account, asOf);
        return isDebitNormal(account) ? debits - credits : credits - debits;
    }

    /**
     * Natural-sign movement of an account over the half-open window {@code [from, to)}.
     */
    @Transactional(readOnly = true)
    public long netMovement(String tenantId, String account, Instant from, Instant to) {
        long debits = ledgerEntryRepository.sumDebitsBetween(tenantId, account, from, to);
        long credits = ledgerEntryRepository.sumCreditsBetween(tenantId, account, from, to);
        return isDebitNormal(account) ? debits - credits : credits - debits;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entries(String tenantId, String account) {
        return ledgerEntryRepository.findByTenantIdAndAccountOrderByIdAsc(tenantId, account);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesForReference(String reference) {
        return ledgerEntryRepository.findByReferenceOrderByIdAsc(reference);
    }

    /**
     * Full-store integrity check: ids of every group whose debits and credits differ.
     */
    @Transactional(readOnly = true)
    public List<String> unbalancedGroups() {
        List<String> unbalanced = ledgerEntryRepository.findUnbalancedGroups();
        if (!unbalanced.isEmpty()) {
            log.error("Ledger integrity check found {} unbalanced groups: {}", unbalanced.size(), unbalanced);
        }
        return unbalanced;
    }

    public static boolean isDebitNormal(String account) {
        return account.startsWith(CASH_PREFIX) || account.startsWith(RECEIVABLE_PREFIX);
    }

    private void validateBalanced(String transactionGroupId, List<LedgerLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw violation(new UnbalancedTransactionException(
                    "Transaction group " + transactionGroupId + " has no lines", transactionGroupId));
        }

        long debits = 0;
        long credits = 0;
        for (LedgerLine line : lines) {
            boolean debit = line.getDebit() > 0;
            boolean credit = line.getCredit() > 0;
            if (debit == credit || line.getDebit() < 0 || line.getCredit() < 0) {
                throw violation(new UnbalancedTransactionException(
                        "Line on " + line.getAccount() + " must carry exactly one positive side", transactionGroupId));
            }
            debits = Math.addExact(debits, line.getDebit());
            credits = Math.addExact(credits, line.getCredit());
        }

        if (debits != credits) {
            throw violation(new UnbalancedTransactionException(
                    "Transaction group " + transactionGroupId + " unbalanced: debits=" + debits
                            + ", credits=" + credits, transactionGroupId));
        }
    }

    private LedgerInvariantException violation(LedgerInvariantException e) {
        invariantViolationCounter.increment();
        log.error("Ledger invariant violated for group={}: {}", e.getTransactionGroupId(), e.getMessage());
        return e;
    }
}
