package com.flagship.trade_ledger.posting;

import com.flagship.trade_ledger.account.CustomerEntity;
import com.flagship.trade_ledger.account.CustomerRepository;
import com.flagship.trade_ledger.account.LedgerRepository;
import com.flagship.trade_ledger.account.VendorRepository;
import com.flagship.trade_ledger.support.Slugs;
import com.flagship.trade_ledger.voucher.PartyType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Component
@RequiredArgsConstructor
public class RepositoryAccountResolver implements AccountResolver {

    private final LedgerRepository ledgerRepository;
    private final CustomerRepository customerRepository;
    private final VendorRepository vendorRepository;

    @Override
    @Transactional(readOnly = true)
    public ResolvedAccount resolveByName(String accountName) {
        if (accountName == null || accountName.isBlank()) {
            return ResolvedAccount.unresolved(accountName);
        }
        String name = accountName.trim();

        var ledgers = ledgerRepository.findActiveBySlugOrName(Slugs.slugify(name), name);
        if (!ledgers.isEmpty()) {
            return ResolvedAccount.ledger(ledgers.get(0).getId(), ledgers.get(0).getName());
        }
        var customers = customerRepository.findActiveByShopOrOwnerName(name);
        if (!customers.isEmpty()) {
            CustomerEntity customer = customers.get(0);
            return ResolvedAccount.customer(customer.getId(), customer.getDisplayName());
        }
        var vendors = vendorRepository.findByVendorNameAndActiveTrueOrderByCreatedAtAsc(name);
        if (!vendors.isEmpty()) {
            return ResolvedAccount.vendor(vendors.get(0).getId(), vendors.get(0).getVendorName());
        }
        return ResolvedAccount.unresolved(name);
    }

    @Override
    @Transactional(readOnly = true)
    public ResolvedAccount resolveParty(PartyType partyType, UUID partyId) {
        if (partyType == null || partyId == null) {
            return ResolvedAccount.unresolved(String.valueOf(partyId));
        }
        return switch (partyType) {
            case CUSTOMER -> customerRepository.findById(partyId)
                .filter(CustomerEntity::isActive)
                .map(c -> ResolvedAccount.customer(c.getId(), c.getDisplayName()))
                .orElseGet(() -> ResolvedAccount.unresolved("customer " + partyId));
            case LEDGER -> ledgerRepository.findByIdAndActiveTrue(partyId)
                .map(l -> ResolvedAccount.ledger(l.getId(), l.getName()))
                .orElseGet(() -> ResolvedAccount.unresolved("ledger " + partyId));
            case VENDOR -> ledgerRepository.findFirstByVendorIdAndActiveTrue(partyId)
                .map(l -> ResolvedAccount.ledger(l.getId(), l.getName()))
                .orElseGet(() -> ResolvedAccount.unresolved("ledger of vendor " + partyId));
        };
    }
}
