package com.flagship.trade_ledger.account;

import com.flagship.trade_ledger.balance.BalanceSide;
import com.flagship.trade_ledger.balance.SignedBalance;
import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Persistence base for every account that carries a balance
 * (ledgers, customers, vendors).
 *
 * Key design principles (shared with the concrete entities):
 * - No setters: the opening balance is fixed at registration
 * - The outstanding balance only changes through {@link #applyOutstanding}
 * - Timestamps are maintained by lifecycle hooks
 */
@MappedSuperclass
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class BalanceAccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "group_id")
    private UUID groupId;

    @Column(name = "opening_balance", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal openingBalance;

    @Enumerated(EnumType.STRING)
    @Column(name = "opening_balance_side", nullable = false, updatable = false, length = 6)
    private BalanceSide openingBalanceSide;

    @Column(name = "outstanding_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal outstandingBalance;

    @Enumerated(EnumType.STRING)
    @Column(name = "outstanding_balance_side", nullable = false, length = 6)
    private BalanceSide outstandingBalanceSide;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "updated_by", nullable = false)
    private String updatedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * New accounts start with the outstanding balance equal to the opening balance.
     */
    protected BalanceAccountEntity(UUID groupId, SignedBalance opening, String actor) {
        this.id = UUID.randomUUID();
        this.groupId = groupId;
        this.openingBalance = opening.getMagnitude();
        this.openingBalanceSide = opening.getSide();
        this.outstandingBalance = opening.getMagnitude();
        this.outstandingBalanceSide = opening.getSide();
        this.active = true;
        this.createdBy = actor;
        this.updatedBy = actor;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public abstract AccountKind getKind();

    /**
     * Name used when matching free-text voucher entries and in reports.
     */
    public abstract String getDisplayName();

    public SignedBalance getOpening() {
        return SignedBalance.of(openingBalance, openingBalanceSide);
    }

    public SignedBalance getOutstanding() {
        return SignedBalance.of(outstandingBalance, outstandingBalanceSide);
    }

    /**
     * Replaces the live outstanding balance. Only the balance mutation path calls this.
     */
    public void applyOutstanding(SignedBalance balance, String actor) {
        this.outstandingBalance = balance.getMagnitude();
        this.outstandingBalanceSide = balance.getSide();
        this.updatedBy = actor;
    }

    public void deactivate(String actor) {
        this.active = false;
        this.updatedBy = actor;
    }

    public AccountSnapshot toSnapshot() {
        return new AccountSnapshot(id, getKind(), getDisplayName(), groupId, getOpening(), getOutstanding());
    }
}
