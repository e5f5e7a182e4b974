package com.flagship.trade_ledger.inventory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Stock movement as seen by the balance engine. Read-only from here.
 */
@Entity
@Table(
    name = "inventory_stocks",
    indexes = {
        @Index(name = "idx_inventory_stocks_vendor", columnList = "vendor_id"),
        @Index(name = "idx_inventory_stocks_date", columnList = "stock_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InventoryStockEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "stock_date", nullable = false)
    private Instant date;

    @Enumerated(EnumType.STRING)
    @Column(name = "stock_type", nullable = false, length = 20)
    private StockType type;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "vendor_id")
    private UUID vendorId;

    public static InventoryStockEntity record(Instant date, StockType type, BigDecimal amount, UUID vendorId) {
        return new InventoryStockEntity(UUID.randomUUID(), date, type, amount, vendorId);
    }

    public InventoryStock toDomain() {
        return new InventoryStock(id, date, type, amount, vendorId);
    }
}
