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
public interface VendorRepository extends JpaRepository<VendorEntity, UUID> {

    List<VendorEntity> findAllByActiveTrue();

    List<VendorEntity> findByVendorNameAndActiveTrueOrderByCreatedAtAsc(String vendorName);

    /**
     * Row-locked read for balance updates.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VendorEntity v WHERE v.id = :id")
    Optional<VendorEntity> findByIdForUpdate(@Param("id") UUID id);
}
