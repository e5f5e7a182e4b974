package com.flagship.trade_ledger.voucher;

import com.flagship.trade_ledger.account.AccountKind;
import com.flagship.trade_ledger.account.LedgerRepository;
import com.flagship.trade_ledger.exception.AccountNotFoundException;
import com.flagship.trade_ledger.exception.VoucherNotFoundException;
import com.flagship.trade_ledger.observability.CorrelationContext;
import com.flagship.trade_ledger.observability.LedgerMetrics;
import com.flagship.trade_ledger.posting.BalanceMutationService;
import com.flagship.trade_ledger.posting.BalanceUpdateReport;
import com.flagship.trade_ledger.replay.ReplayCutoff;
import com.flagship.trade_ledger.sequence.SequenceAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Voucher lifecycle: post, edit, deactivate, query.
 *
 * Order of operations for a post:
 * 1. Validate the shape (nothing is touched on failure)
 * 2. Require the cash/bank ledger of a Payment/Receipt to exist
 * 3. Allocate the number and store the voucher (one transaction)
 * 4. Update account balances, each account independently
 *
 * Balance update failures are reported, never thrown: the voucher stays
 * stored and the reconciliation report shows any resulting drift.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoucherService {

    private static final Instant OPEN_END = Instant.parse("9999-12-31T23:59:59.999Z");

    private final VoucherValidator validator;
    private final VoucherPersistenceService persistenceService;
    private final BalanceMutationService balanceMutationService;
    private final LedgerRepository ledgerRepository;
    private final SequenceAllocator sequenceAllocator;
    private final LedgerMetrics metrics;

    @Value("${ledger.report.zone:UTC}")
    private String zone;

    public PostedVoucher postVoucher(VoucherDraft draft, String actor) {
        return timed("create", () -> {
            validator.validate(draft);
            requireCashAccount(draft);

            Voucher saved = persistenceService.create(draft, actor);
            MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, saved.getId().toString());

            BalanceUpdateReport applied = balanceMutationService.apply(saved, actor);
            metrics.recordVoucherPosted(saved.getVoucherType().name(), "create");

            log.info("Voucher posted: voucherNumber={}, type={}, totalDebit={}, totalCredit={}, failedUpdates={}",
                saved.getVoucherNumber(), saved.getVoucherType(), saved.getTotalDebit(), saved.getTotalCredit(),
                applied.getFailed().size());
            return new PostedVoucher(saved, BalanceUpdateReport.EMPTY, applied);
        });
    }

    /**
     * Stores the new shape, then backs out the old effect and applies the new one.
     */
    public PostedVoucher updateVoucher(UUID voucherId, VoucherDraft draft, String actor) {
        return timed("update", () -> {
            validator.validate(draft);
            requireCashAccount(draft);
            MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, voucherId.toString());

            Voucher previous = findActive(voucherId);
            Voucher updated = persistenceService.update(voucherId, draft, actor);

            BalanceUpdateReport reversed = balanceMutationService.reverse(previous, actor);
            BalanceUpdateReport applied = balanceMutationService.apply(updated, actor);
            metrics.recordVoucherPosted(updated.getVoucherType().name(), "update");

            log.info("Voucher updated: voucherNumber={}, type={}, previousType={}, totalDebit={}",
                updated.getVoucherNumber(), updated.getVoucherType(), previous.getVoucherType(),
                updated.getTotalDebit());
            return new PostedVoucher(updated, reversed, applied);
        });
    }

    /**
     * Soft-deletes a voucher and backs out its effect. Deactivating an
     * already inactive voucher changes nothing.
     */
    public PostedVoucher deactivateVoucher(UUID voucherId, String actor) {
        return timed("deactivate", () -> {
            MDC.put(CorrelationContext.VOUCHER_ID_MDC_KEY, voucherId.toString());
            Voucher existing = findVoucher(voucherId);
            if (!existing.isActive()) {
                log.info("Voucher already inactive: voucherNumber={}", existing.getVoucherNumber());
                return new PostedVoucher(existing, BalanceUpdateReport.EMPTY, BalanceUpdateReport.EMPTY);
            }

            Voucher deactivated = persistenceService.deactivate(voucherId, actor);
            BalanceUpdateReport reversed = balanceMutationService.reverse(existing, actor);
            metrics.recordVoucherPosted(existing.getVoucherType().name(), "deactivate");

            log.info("Voucher deactivated: voucherNumber={}, type={}",
                deactivated.getVoucherNumber(), deactivated.getVoucherType());
            return new PostedVoucher(deactivated, reversed, BalanceUpdateReport.EMPTY);
        });
    }

    public Voucher findVoucher(UUID voucherId) {
        return persistenceService.findById(voucherId)
            .orElseThrow(() -> new VoucherNotFoundException(voucherId));
    }

    /**
     * Active vouchers in number order, optionally by type and inclusive date range.
     */
    public List<Voucher> listVouchers(VoucherType type, LocalDate from, LocalDate to) {
        return persistenceService.findActiveBetween(startOf(from), endOf(to)).stream()
            .filter(v -> type == null || v.getVoucherType() == type)
            .toList();
    }

    public VoucherStats voucherStats(LocalDate from, LocalDate to) {
        Map<VoucherType, VoucherStats.TypeTotals> byType = new EnumMap<>(VoucherType.class);
        for (VoucherType type : VoucherType.values()) {
            byType.put(type, VoucherStats.TypeTotals.EMPTY);
        }
        long count = 0;
        BigDecimal totalDebit = BigDecimal.ZERO;
        BigDecimal totalCredit = BigDecimal.ZERO;

        for (Voucher voucher : persistenceService.findActiveBetween(startOf(from), endOf(to))) {
            byType.put(voucher.getVoucherType(), byType.get(voucher.getVoucherType()).plus(voucher));
            count++;
            totalDebit = totalDebit.add(voucher.getTotalDebit());
            totalCredit = totalCredit.add(voucher.getTotalCredit());
        }
        return new VoucherStats(byType, count, totalDebit, totalCredit);
    }

    /**
     * The number the next posted voucher will probably get.
     */
    public long peekNextVoucherNumber() {
        return sequenceAllocator.peek(SequenceAllocator.VOUCHER_NUMBER);
    }

    private Voucher findActive(UUID voucherId) {
        return persistenceService.findById(voucherId)
            .filter(Voucher::isActive)
            .orElseThrow(() -> new VoucherNotFoundException(voucherId));
    }

    private void requireCashAccount(VoucherDraft draft) {
        if (draft.getVoucherType().isPartyBased()
            && ledgerRepository.findByIdAndActiveTrue(draft.getAccountId()).isEmpty()) {
            throw new AccountNotFoundException(AccountKind.LEDGER, draft.getAccountId());
        }
    }

    private <T> T timed(String operation, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.warn("Voucher {} failed: error={}", operation, e.getMessage());
            throw e;
        } finally {
            metrics.recordVoucherLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.VOUCHER_ID_MDC_KEY);
        }
    }

    private Instant startOf(LocalDate from) {
        return from == null ? Instant.EPOCH : from.atStartOfDay(ZoneId.of(zone)).toInstant();
    }

    private Instant endOf(LocalDate to) {
        return to == null ? OPEN_END : ReplayCutoff.endOfDay(to, ZoneId.of(zone));
    }
}
