package com.flagship.trade_ledger.report;

import com.flagship.trade_ledger.account.AccountSnapshot;
import com.flagship.trade_ledger.group.GroupForest;
import com.flagship.trade_ledger.group.GroupNode;
import com.flagship.trade_ledger.group.GroupTreeBuilder;
import com.flagship.trade_ledger.group.GroupType;
import com.flagship.trade_ledger.observability.LedgerMetrics;
import com.flagship.trade_ledger.replay.AccountTotals;
import com.flagship.trade_ledger.replay.ReplaySnapshot;
import com.flagship.trade_ledger.replay.TransactionReplayAggregator;
import com.flagship.trade_ledger.replay.VoucherBalanceMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Rolls replayed account balances up the group hierarchy into a balance sheet.
 *
 * A group's balance is its direct accounts' replayed net times the group's
 * sign (+1 Assets, -1 Liability) plus its children's balances. A ledger's
 * net is its opening balance plus its voucher movement; customers and
 * vendors use their full replay (vouchers, trips, stock).
 *
 * Section totals sum the absolute balances of root groups only, since roots
 * already include their descendants.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceRollupEngine {

    private final TransactionReplayAggregator aggregator;
    private final GroupTreeBuilder treeBuilder;
    private final LedgerMetrics metrics;

    public BalanceSheet rollUp(ReplaySnapshot snapshot) {
        VoucherBalanceMap voucherMap = aggregator.buildVoucherBalanceMap(snapshot.getVouchers(), snapshot.getCutoff());
        Rollup rollup = new Rollup(snapshot, voucherMap);

        GroupForest assetForest = treeBuilder.build(snapshot.groupsOfType(GroupType.ASSETS));
        GroupForest liabilityForest = treeBuilder.build(snapshot.groupsOfType(GroupType.LIABILITY));

        List<GroupBalance> assets = assetForest.getRoots().stream()
            .map(root -> rollup.balanceOf(root, BigDecimal.ONE))
            .toList();
        List<GroupBalance> liabilities = liabilityForest.getRoots().stream()
            .map(root -> rollup.balanceOf(root, BigDecimal.ONE.negate()))
            .toList();

        BigDecimal capital = rollup.guarded("capital", () ->
            aggregator.capital(voucherMap, snapshot.getLedgers(), snapshot.groupTypes()));

        BigDecimal totalAssets = sumOfRoots(assets);
        BigDecimal totalLiabilities = sumOfRoots(liabilities);
        BigDecimal totalCapital = capital.abs();
        BigDecimal totalLiabilitiesAndCapital = totalLiabilities.add(totalCapital);

        List<UUID> detached = new ArrayList<>(assetForest.getDetachedCycles());
        detached.addAll(liabilityForest.getDetachedCycles());

        return BalanceSheet.builder()
            .asOf(snapshot.getAsOf())
            .assets(new BalanceSheet.Section(assets, totalAssets))
            .liabilities(new BalanceSheet.Section(liabilities, totalLiabilities))
            .capital(new BalanceSheet.Capital(capital, totalCapital))
            .totals(BalanceSheet.Totals.builder()
                .totalAssets(totalAssets)
                .totalLiabilities(totalLiabilities)
                .totalCapital(totalCapital)
                .totalLiabilitiesAndCapital(totalLiabilitiesAndCapital)
                .balance(totalAssets.subtract(totalLiabilitiesAndCapital))
                .build())
            .computationErrors(rollup.errors)
            .detachedGroups(List.copyOf(detached))
            .build();
    }

    private static BigDecimal sumOfRoots(List<GroupBalance> roots) {
        return roots.stream()
            .map(g -> g.getBalance().abs())
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * State of one rollup: the voucher map, accounts indexed by group, and
     * the count of accounts whose replay failed.
     */
    private final class Rollup {

        private final ReplaySnapshot snapshot;
        private final VoucherBalanceMap voucherMap;
        private final Map<UUID, List<AccountSnapshot>> ledgersByGroup;
        private final Map<UUID, List<AccountSnapshot>> customersByGroup;
        private final Map<UUID, List<AccountSnapshot>> vendorsByGroup;
        private int errors;

        Rollup(ReplaySnapshot snapshot, VoucherBalanceMap voucherMap) {
            this.snapshot = snapshot;
            this.voucherMap = voucherMap;
            this.ledgersByGroup = byGroup(snapshot.getLedgers());
            this.customersByGroup = byGroup(snapshot.getCustomers());
            this.vendorsByGroup = byGroup(snapshot.getVendors());
        }

        GroupBalance balanceOf(GroupNode node, BigDecimal sign) {
            UUID groupId = node.getGroup().getId();
            BigDecimal net = BigDecimal.ZERO;
            BigDecimal debit = BigDecimal.ZERO;
            BigDecimal credit = BigDecimal.ZERO;
            BigDecimal opening = BigDecimal.ZERO;
            BigDecimal outstanding = BigDecimal.ZERO;

            for (AccountSnapshot ledger : ledgersByGroup.getOrDefault(groupId, List.of())) {
                AccountTotals totals = guardedTotals(ledger);
                BigDecimal ledgerNet = ledger.getOpening().toSigned().add(totals.balance());
                net = net.add(ledgerNet);
                debit = debit.add(totals.getDebitTotal());
                credit = credit.add(totals.getCreditTotal());
                opening = opening.add(ledger.getOpening().getMagnitude());
                outstanding = outstanding.add(ledger.getOutstanding().getMagnitude());
            }

            List<BigDecimal> partyNets = new ArrayList<>();
            for (AccountSnapshot customer : customersByGroup.getOrDefault(groupId, List.of())) {
                partyNets.add(guarded("customer " + customer.getId(), () -> aggregator.customerBalance(
                    customer, snapshot.getVouchers(), snapshot.getTrips(), snapshot.getCutoff())));
                opening = opening.add(customer.getOpening().getMagnitude());
            }
            for (AccountSnapshot vendor : vendorsByGroup.getOrDefault(groupId, List.of())) {
                partyNets.add(guarded("vendor " + vendor.getId(), () -> aggregator.vendorBalance(
                    vendor, snapshot.getVouchers(), snapshot.getTrips(), snapshot.getStocks(), snapshot.getCutoff())));
                opening = opening.add(vendor.getOpening().getMagnitude());
            }
            for (BigDecimal partyNet : partyNets) {
                net = net.add(partyNet);
                if (partyNet.signum() > 0) {
                    debit = debit.add(partyNet);
                } else {
                    credit = credit.add(partyNet.negate());
                }
            }

            BigDecimal balance = net.multiply(sign);
            List<GroupBalance> children = new ArrayList<>();
            for (GroupNode child : node.getChildren()) {
                GroupBalance childBalance = balanceOf(child, sign);
                children.add(childBalance);
                balance = balance.add(childBalance.getBalance());
                debit = debit.add(childBalance.getDebitTotal());
                credit = credit.add(childBalance.getCreditTotal());
                opening = opening.add(childBalance.getOpeningBalance());
                outstanding = outstanding.add(childBalance.getOutstandingBalance());
            }

            return GroupBalance.builder()
                .id(groupId)
                .name(node.getGroup().getName())
                .type(node.getGroup().getType())
                .balance(balance)
                .debitTotal(debit)
                .creditTotal(credit)
                .openingBalance(opening)
                .outstandingBalance(outstanding)
                .children(List.copyOf(children))
                .build();
        }

        private AccountTotals guardedTotals(AccountSnapshot ledger) {
            try {
                return aggregator.ledgerBalance(ledger, voucherMap);
            } catch (RuntimeException e) {
                recordError("ledger " + ledger.getId(), e);
                return AccountTotals.ZERO;
            }
        }

        BigDecimal guarded(String what, Supplier<BigDecimal> computation) {
            try {
                return computation.get();
            } catch (RuntimeException e) {
                recordError(what, e);
                return BigDecimal.ZERO;
            }
        }

        private void recordError(String what, RuntimeException e) {
            errors++;
            metrics.incrementComputationErrors();
            log.error("Balance replay failed, counting as zero: account={}, error={}", what, e.getMessage());
        }
    }

    private static Map<UUID, List<AccountSnapshot>> byGroup(Collection<AccountSnapshot> accounts) {
        return accounts.stream()
            .filter(a -> a.getGroupId() != null)
            .collect(Collectors.groupingBy(AccountSnapshot::getGroupId));
    }
}
