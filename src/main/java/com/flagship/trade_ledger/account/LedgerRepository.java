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
public interface LedgerRepository extends JpaRepository<LedgerEntity, UUID> {

    List<LedgerEntity> findAllByActiveTrue();

    Optional<LedgerEntity> findByIdAndActiveTrue(UUID id);

    /**
     * The ledger linked to a vendor, used when a voucher names the vendor as a party.
     */
    Optional<LedgerEntity> findFirstByVendorIdAndActiveTrue(UUID vendorId);

    /**
     * Matches free-text voucher entry names against slug or exact name.
     */
    @Query("SELECT l FROM LedgerEntity l WHERE l.active = true AND (l.slug = :slug OR l.name = :name) ORDER BY l.createdAt")
    List<LedgerEntity> findActiveBySlugOrName(@Param("slug") String slug, @Param("name") String name);

    /**
     * Row-locked read for balance updates.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LedgerEntity l WHERE l.id = :id")
    Optional<LedgerEntity> findByIdForUpdate(@Param("id") UUID id);
}
