package com.flagship.trade_ledger.trip;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.BatchSize;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Trip record as seen by the balance engine (sales and purchases only).
 * Trips are owned by the trip module; the engine only reads them.
 */
@Entity
@Table(name = "trips")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TripEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @ElementCollection
    @CollectionTable(name = "trip_sales", joinColumns = @JoinColumn(name = "trip_id"))
    @OrderColumn(name = "position")
    @BatchSize(size = 100)
    private List<Sale> sales = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "trip_purchases", joinColumns = @JoinColumn(name = "trip_id"))
    @OrderColumn(name = "position")
    @BatchSize(size = 100)
    private List<Purchase> purchases = new ArrayList<>();

    public static TripEntity record(Instant createdAt, List<TripSale> sales, List<TripPurchase> purchases) {
        TripEntity entity = new TripEntity();
        entity.id = UUID.randomUUID();
        entity.createdAt = createdAt;
        sales.forEach(s -> entity.sales.add(new Sale(s.getClientId(), s.getAmount(), s.getCashPaid(),
            s.getOnlinePaid(), s.getDiscount(), s.isReceipt())));
        purchases.forEach(p -> entity.purchases.add(new Purchase(p.getSupplierId(), p.getAmount())));
        return entity;
    }

    public Trip toDomain() {
        return new Trip(
            id,
            createdAt,
            sales.stream().map(Sale::toDomain).toList(),
            purchases.stream().map(Purchase::toDomain).toList()
        );
    }

    @Embeddable
    @Getter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    static class Sale {

        @Column(name = "client_id")
        private UUID clientId;

        @Column(nullable = false, precision = 19, scale = 2)
        private BigDecimal amount;

        @Column(name = "cash_paid", precision = 19, scale = 2)
        private BigDecimal cashPaid;

        @Column(name = "online_paid", precision = 19, scale = 2)
        private BigDecimal onlinePaid;

        @Column(precision = 19, scale = 2)
        private BigDecimal discount;

        @Column(name = "is_receipt", nullable = false)
        private boolean receipt;

        TripSale toDomain() {
            return new TripSale(clientId, amount, cashPaid, onlinePaid, discount, receipt);
        }
    }

    @Embeddable
    @Getter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    static class Purchase {

        @Column(name = "supplier_id")
        private UUID supplierId;

        @Column(nullable = false, precision = 19, scale = 2)
        private BigDecimal amount;

        TripPurchase toDomain() {
            return new TripPurchase(supplierId, amount);
        }
    }
}
