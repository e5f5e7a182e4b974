package com.flagship.trade_ledger.account;

import com.flagship.trade_ledger.balance.SignedBalance;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A customer (receivable). Only the fields the balance engine needs are mapped.
 */
@Entity
@Table(name = "customers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerEntity extends BalanceAccountEntity {

    @Column(name = "shop_name", nullable = false, length = 100)
    private String shopName;

    @Column(name = "owner_name", length = 100)
    private String ownerName;

    private CustomerEntity(String shopName, String ownerName, UUID groupId, SignedBalance opening, String actor) {
        super(groupId, opening, actor);
        this.shopName = shopName;
        this.ownerName = ownerName;
    }

    public static CustomerEntity register(String shopName, String ownerName, UUID groupId,
                                          SignedBalance opening, String actor) {
        return new CustomerEntity(shopName, ownerName, groupId, opening, actor);
    }

    @Override
    public AccountKind getKind() {
        return AccountKind.CUSTOMER;
    }

    @Override
    public String getDisplayName() {
        if (shopName != null && !shopName.isBlank()) {
            return shopName;
        }
        return ownerName;
    }
}
