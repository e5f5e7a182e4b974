package com.flagship.trade_ledger.trip;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface TripRepository extends JpaRepository<TripEntity, UUID> {

    List<TripEntity> findAllByCreatedAtLessThanEqual(Instant cutoff);
}
