package com.flagship.trade_ledger.voucher;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.BatchSize;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for vouchers.
 *
 * - No setters: changes go through {@link #updateFromDomain} and {@link #deactivate}
 * - voucherNumber, createdBy and createdAt never change after insert
 * - Parties and entries are owned value collections, replaced wholesale on edit
 */
@Entity
@Table(
    name = "vouchers",
    indexes = {
        @Index(name = "idx_vouchers_date", columnList = "voucher_date"),
        @Index(name = "idx_vouchers_type", columnList = "voucher_type")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VoucherEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "voucher_number", nullable = false, unique = true, updatable = false)
    private long voucherNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "voucher_type", nullable = false, length = 10)
    private VoucherType voucherType;

    @Column(name = "voucher_date", nullable = false)
    private Instant date;

    @ElementCollection
    @CollectionTable(name = "voucher_parties", joinColumns = @JoinColumn(name = "voucher_id"))
    @OrderColumn(name = "position")
    @BatchSize(size = 100)
    private List<VoucherPartyEmbeddable> parties = new ArrayList<>();

    @Column(name = "account_id")
    private UUID accountId;

    @ElementCollection
    @CollectionTable(name = "voucher_entries", joinColumns = @JoinColumn(name = "voucher_id"))
    @OrderColumn(name = "position")
    @BatchSize(size = 100)
    private List<VoucherEntryEmbeddable> entries = new ArrayList<>();

    @Column(name = "total_debit", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalDebit;

    @Column(name = "total_credit", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalCredit;

    @Column(length = 500)
    private String narration;

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

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * The only way to create a VoucherEntity.
     */
    static VoucherEntity fromDomain(Voucher voucher) {
        VoucherEntity entity = new VoucherEntity();
        entity.id = voucher.getId();
        entity.voucherNumber = voucher.getVoucherNumber();
        entity.active = true;
        entity.createdBy = voucher.getCreatedBy();
        entity.applyShape(voucher);
        return entity;
    }

    /**
     * Replaces the editable part of the voucher. Number and creation data are kept.
     */
    void updateFromDomain(Voucher voucher) {
        applyShape(voucher);
    }

    void deactivate(String actor) {
        this.active = false;
        this.updatedBy = actor;
    }

    private void applyShape(Voucher voucher) {
        this.voucherType = voucher.getVoucherType();
        this.date = voucher.getDate();
        this.accountId = voucher.getAccountId();
        this.totalDebit = voucher.getTotalDebit();
        this.totalCredit = voucher.getTotalCredit();
        this.narration = voucher.getNarration();
        this.updatedBy = voucher.getUpdatedBy();
        this.parties.clear();
        voucher.getParties().forEach(p -> this.parties.add(VoucherPartyEmbeddable.fromDomain(p)));
        this.entries.clear();
        voucher.getEntries().forEach(e -> this.entries.add(VoucherEntryEmbeddable.fromDomain(e)));
    }

    public Voucher toDomain() {
        return Voucher.builder()
            .id(id)
            .voucherNumber(voucherNumber)
            .voucherType(voucherType)
            .date(date)
            .parties(parties.stream().map(VoucherPartyEmbeddable::toDomain).toList())
            .accountId(accountId)
            .entries(entries.stream().map(VoucherEntryEmbeddable::toDomain).toList())
            .totalDebit(totalDebit)
            .totalCredit(totalCredit)
            .narration(narration)
            .active(active)
            .createdBy(createdBy)
            .updatedBy(updatedBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }
}
