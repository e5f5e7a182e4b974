package com.flagship.trade_ledger.account;

import com.flagship.trade_ledger.balance.SignedBalance;
import com.flagship.trade_ledger.support.Slugs;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A general-ledger account. A ledger may stand in for a vendor or customer
 * (vendor payments are posted to the vendor's linked ledger).
 */
@Entity
@Table(
    name = "ledgers",
    indexes = {
        @Index(name = "idx_ledgers_group", columnList = "group_id"),
        @Index(name = "idx_ledgers_vendor", columnList = "vendor_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerEntity extends BalanceAccountEntity {

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, unique = true, length = 120)
    private String slug;

    @Enumerated(EnumType.STRING)
    @Column(name = "ledger_type", nullable = false, length = 10)
    private LedgerType ledgerType;

    @Column(name = "vendor_id")
    private UUID vendorId;

    @Column(name = "customer_id")
    private UUID customerId;

    private LedgerEntity(String name, UUID groupId, SignedBalance opening, LedgerType ledgerType,
                         UUID vendorId, UUID customerId, String actor) {
        super(groupId, opening, actor);
        this.name = name.trim();
        this.slug = Slugs.slugify(name);
        this.ledgerType = ledgerType;
        this.vendorId = vendorId;
        this.customerId = customerId;
    }

    public static LedgerEntity register(String name, UUID groupId, SignedBalance opening, String actor) {
        return new LedgerEntity(name, groupId, opening, LedgerType.OTHER, null, null, actor);
    }

    public static LedgerEntity registerForVendor(String name, UUID groupId, SignedBalance opening,
                                                 UUID vendorId, String actor) {
        return new LedgerEntity(name, groupId, opening, LedgerType.VENDOR, vendorId, null, actor);
    }

    public static LedgerEntity registerForCustomer(String name, UUID groupId, SignedBalance opening,
                                                   UUID customerId, String actor) {
        return new LedgerEntity(name, groupId, opening, LedgerType.CUSTOMER, null, customerId, actor);
    }

    @Override
    public AccountKind getKind() {
        return AccountKind.LEDGER;
    }

    @Override
    public String getDisplayName() {
        return name;
    }
}
