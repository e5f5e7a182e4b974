package com.flagship.trade_ledger.inventory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface InventoryStockRepository extends JpaRepository<InventoryStockEntity, UUID> {

    List<InventoryStockEntity> findAllByDateLessThanEqual(Instant cutoff);
}
