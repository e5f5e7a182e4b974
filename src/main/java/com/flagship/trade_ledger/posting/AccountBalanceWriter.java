package com.flagship.trade_ledger.posting;

import com.flagship.trade_ledger.account.AccountKind;
import com.flagship.trade_ledger.account.BalanceAccountEntity;
import com.flagship.trade_ledger.account.CustomerEntity;
import com.flagship.trade_ledger.account.CustomerRepository;
import com.flagship.trade_ledger.account.LedgerEntity;
import com.flagship.trade_ledger.account.LedgerRepository;
import com.flagship.trade_ledger.account.VendorEntity;
import com.flagship.trade_ledger.account.VendorRepository;
import com.flagship.trade_ledger.balance.BalanceSide;
import com.flagship.trade_ledger.balance.SignedBalance;
import com.flagship.trade_ledger.exception.AccountNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Writes one account's outstanding balance.
 *
 * Every call runs in its own transaction and holds the account's row lock
 * until it commits. A failure rolls back only that account.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccountBalanceWriter {

    private final LedgerRepository ledgerRepository;
    private final CustomerRepository customerRepository;
    private final VendorRepository vendorRepository;

    /**
     * Combines the debit delta, then the credit delta, into the stored balance.
     *
     * @throws AccountNotFoundException if the account is missing or inactive
     * @throws com.flagship.trade_ledger.balance.BalanceComputationException if a delta is negative
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BalanceChange apply(AccountKind kind, UUID accountId, BigDecimal debit, BigDecimal credit, String actor) {
        BalanceAccountEntity account = load(kind, accountId);
        SignedBalance before = account.getOutstanding();
        SignedBalance after = before
            .combine(debit, BalanceSide.DEBIT)
            .combine(credit, BalanceSide.CREDIT);

        account.applyOutstanding(after, actor);
        save(account);

        log.debug("Outstanding balance updated: kind={}, accountId={}, before={}, after={}",
            kind, accountId, before, after);
        return new BalanceChange(before, after);
    }

    private BalanceAccountEntity load(AccountKind kind, UUID accountId) {
        BalanceAccountEntity account = switch (kind) {
            case LEDGER -> ledgerRepository.findByIdForUpdate(accountId).orElse(null);
            case CUSTOMER -> customerRepository.findByIdForUpdate(accountId).orElse(null);
            case VENDOR -> vendorRepository.findByIdForUpdate(accountId).orElse(null);
        };
        if (account == null || !account.isActive()) {
            throw new AccountNotFoundException(kind, accountId);
        }
        return account;
    }

    private void save(BalanceAccountEntity account) {
        switch (account.getKind()) {
            case LEDGER -> ledgerRepository.save((LedgerEntity) account);
            case CUSTOMER -> customerRepository.save((CustomerEntity) account);
            case VENDOR -> vendorRepository.save((VendorEntity) account);
        }
    }

    @Value
    public static class BalanceChange {
        SignedBalance before;
        SignedBalance after;
    }
}
