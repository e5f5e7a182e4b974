package com.flagship.trade_ledger.voucher;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface VoucherRepository extends JpaRepository<VoucherEntity, UUID> {

    /**
     * Active vouchers dated on or before the cutoff, oldest first. Used by replay.
     */
    List<VoucherEntity> findAllByActiveTrueAndDateLessThanEqualOrderByDateAsc(Instant cutoff);

    List<VoucherEntity> findAllByActiveTrueAndDateBetweenOrderByVoucherNumberAsc(Instant from, Instant to);
}
