package com.flagship.trade_ledger.posting;

import com.flagship.trade_ledger.balance.BalanceComputationException;
import com.flagship.trade_ledger.balance.BalanceSide;
import com.flagship.trade_ledger.exception.AccountNotFoundException;
import com.flagship.trade_ledger.observability.CorrelationContext;
import com.flagship.trade_ledger.observability.LedgerMetrics;
import com.flagship.trade_ledger.voucher.PartyType;
import com.flagship.trade_ledger.voucher.Voucher;
import com.flagship.trade_ledger.voucher.VoucherEntry;
import com.flagship.trade_ledger.voucher.VoucherParty;
import com.flagship.trade_ledger.voucher.VoucherType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Keeps live outstanding balances in step with posted vouchers.
 *
 * Payment and Receipt move every party to one side (Payment DEBIT, Receipt
 * CREDIT) and the cash/bank account to the other side for the party total.
 * Journal and Contra entries are resolved by account name and apply their
 * debit and credit amounts as given.
 *
 * Deltas are netted per account first, so each account is written once per
 * call. Each write is independent: an account that cannot be found is
 * skipped, an account whose update throws is reported as failed, and neither
 * stops the remaining accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceMutationService {

    private final AccountResolver accountResolver;
    private final AccountBalanceWriter balanceWriter;
    private final LedgerMetrics metrics;

    public BalanceUpdateReport apply(Voucher voucher, String actor) {
        return post(voucher, actor, false);
    }

    /**
     * Backs out a voucher's earlier effect (edit or deactivation).
     */
    public BalanceUpdateReport reverse(Voucher voucher, String actor) {
        return post(voucher, actor, true);
    }

    private BalanceUpdateReport post(Voucher voucher, String actor, boolean reversal) {
        List<BalanceUpdateResult> results = new ArrayList<>();
        Map<ResolvedAccount, PendingDelta> deltas = collectDeltas(voucher, results);

        for (Map.Entry<ResolvedAccount, PendingDelta> entry : deltas.entrySet()) {
            PendingDelta delta = reversal ? entry.getValue().mirrored() : entry.getValue();
            results.add(write(entry.getKey(), delta, actor));
        }

        BalanceUpdateReport report = BalanceUpdateReport.of(results);
        log.info("Balances {}: voucherId={}, voucherNumber={}, applied={}, skipped={}, failed={}",
            reversal ? "reversed" : "applied", voucher.getId(), voucher.getVoucherNumber(),
            report.getApplied().size(), report.getSkipped().size(), report.getFailed().size());
        return report;
    }

    private Map<ResolvedAccount, PendingDelta> collectDeltas(Voucher voucher, List<BalanceUpdateResult> results) {
        Map<ResolvedAccount, PendingDelta> deltas = new LinkedHashMap<>();
        if (voucher.getVoucherType().isPartyBased()) {
            BalanceSide partySide = voucher.getVoucherType() == VoucherType.PAYMENT
                ? BalanceSide.DEBIT
                : BalanceSide.CREDIT;

            for (VoucherParty party : voucher.getParties()) {
                ResolvedAccount target = resolve(() -> accountResolver.resolveParty(party.getPartyType(), party.getPartyId()),
                    String.valueOf(party.getPartyId()));
                addOrSkip(deltas, results, target, partySide, party.getAmount());
            }
            ResolvedAccount cashAccount = resolve(() -> accountResolver.resolveParty(PartyType.LEDGER, voucher.getAccountId()),
                String.valueOf(voucher.getAccountId()));
            addOrSkip(deltas, results, cashAccount, partySide.opposite(), voucher.partyTotal());
        } else {
            for (VoucherEntry entry : voucher.getEntries()) {
                ResolvedAccount target = resolve(() -> accountResolver.resolveByName(entry.getAccount()), entry.getAccount());
                if (entry.debitOrZero().signum() > 0) {
                    addOrSkip(deltas, results, target, BalanceSide.DEBIT, entry.getDebitAmount());
                }
                if (entry.creditOrZero().signum() > 0) {
                    addOrSkip(deltas, results, target, BalanceSide.CREDIT, entry.getCreditAmount());
                }
            }
        }
        return deltas;
    }

    private ResolvedAccount resolve(Supplier<ResolvedAccount> lookup, String reference) {
        try {
            return lookup.get();
        } catch (RuntimeException e) {
            log.error("Account lookup failed: reference={}", reference, e);
            return ResolvedAccount.unresolved(reference);
        }
    }

    private void addOrSkip(Map<ResolvedAccount, PendingDelta> deltas, List<BalanceUpdateResult> results,
                           ResolvedAccount target, BalanceSide side, BigDecimal amount) {
        if (!target.isResolved()) {
            log.warn("Voucher line does not match any account, skipping: reference={}", target.getName());
            metrics.recordBalanceUpdate("unresolved", LedgerMetrics.OUTCOME_SKIPPED);
            results.add(BalanceUpdateResult.skipped(target, "Account not found"));
            return;
        }
        if (amount == null || amount.signum() < 0) {
            log.error("Invalid delta amount, line ignored: accountId={}, side={}, amount={}",
                target.getId(), side, amount);
            metrics.incrementComputationErrors();
            metrics.recordBalanceUpdate(target.getKind().name().toLowerCase(), LedgerMetrics.OUTCOME_FAILED);
            results.add(BalanceUpdateResult.failed(target, "Delta amount must be non-negative: " + amount));
            return;
        }
        deltas.computeIfAbsent(target, k -> new PendingDelta()).add(side, amount);
    }

    private BalanceUpdateResult write(ResolvedAccount target, PendingDelta delta, String actor) {
        String kind = target.getKind().name().toLowerCase();
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(target.getId()));
        try {
            AccountBalanceWriter.BalanceChange change = balanceWriter.apply(
                target.toAccountKind(), target.getId(), delta.debit, delta.credit, actor);
            metrics.recordBalanceUpdate(kind, LedgerMetrics.OUTCOME_APPLIED);
            return BalanceUpdateResult.applied(target, change.getBefore(), change.getAfter());
        } catch (AccountNotFoundException e) {
            log.warn("Account disappeared before its balance could be updated: kind={}, accountId={}",
                kind, target.getId());
            metrics.recordBalanceUpdate(kind, LedgerMetrics.OUTCOME_SKIPPED);
            return BalanceUpdateResult.skipped(target, e.getMessage());
        } catch (BalanceComputationException e) {
            log.error("Balance computation failed: kind={}, accountId={}, error={}",
                kind, target.getId(), e.getMessage());
            metrics.incrementComputationErrors();
            metrics.recordBalanceUpdate(kind, LedgerMetrics.OUTCOME_FAILED);
            return BalanceUpdateResult.failed(target, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Balance update failed: kind={}, accountId={}", kind, target.getId(), e);
            metrics.recordBalanceUpdate(kind, LedgerMetrics.OUTCOME_FAILED);
            return BalanceUpdateResult.failed(target, e.getMessage());
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    /**
     * Debit and credit accumulated for one account.
     */
    private static final class PendingDelta {
        private BigDecimal debit = BigDecimal.ZERO;
        private BigDecimal credit = BigDecimal.ZERO;

        void add(BalanceSide side, BigDecimal amount) {
            if (side == BalanceSide.DEBIT) {
                debit = debit.add(amount);
            } else {
                credit = credit.add(amount);
            }
        }

        PendingDelta mirrored() {
            PendingDelta mirror = new PendingDelta();
            mirror.debit = credit;
            mirror.credit = debit;
            return mirror;
        }
    }
}
