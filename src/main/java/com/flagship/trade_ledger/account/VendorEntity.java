package com.flagship.trade_ledger.account;

import com.flagship.trade_ledger.balance.BalanceSide;
import com.flagship.trade_ledger.balance.SignedBalance;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A vendor (payable). Opening balances default to the CREDIT side.
 */
@Entity
@Table(name = "vendors")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VendorEntity extends BalanceAccountEntity {

    @Column(name = "vendor_name", nullable = false, length = 100)
    private String vendorName;

    private VendorEntity(String vendorName, UUID groupId, SignedBalance opening, String actor) {
        super(groupId, opening, actor);
        this.vendorName = vendorName;
    }

    public static VendorEntity register(String vendorName, UUID groupId, SignedBalance opening, String actor) {
        return new VendorEntity(vendorName, groupId, opening, actor);
    }

    /**
     * Registers a vendor whose opening amount is a payable.
     */
    public static VendorEntity registerPayable(String vendorName, UUID groupId, BigDecimal openingAmount, String actor) {
        return new VendorEntity(vendorName, groupId, SignedBalance.of(openingAmount, BalanceSide.CREDIT), actor);
    }

    @Override
    public AccountKind getKind() {
        return AccountKind.VENDOR;
    }

    @Override
    public String getDisplayName() {
        return vendorName;
    }
}
