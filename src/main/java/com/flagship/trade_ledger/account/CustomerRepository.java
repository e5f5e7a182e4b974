package com.flagship.trade_ledger.account;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CustomerRepository extends JpaRepository<CustomerEntity, UUID> {

    List<CustomerEntity> findAllByActiveTrue();

    @Query("SELECT c FROM CustomerEntity c WHERE c.active = true AND (c.shopName = :name OR c.ownerName = :name) ORDER BY c.createdAt")
    List<CustomerEntity> findActiveByShopOrOwnerName(@Param("name") String name);

    /**
     * Row-locked read for balance updates.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CustomerEntity c WHERE c.id = :id")
    Optional<CustomerEntity> findByIdForUpdate(@Param("id") UUID id);
}
