package com.flagship.trade_ledger.group;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GroupRepository extends JpaRepository<GroupEntity, UUID> {

    List<GroupEntity> findAllByActiveTrue();

    List<GroupEntity> findAllByTypeAndActiveTrueOrderByNameAsc(GroupType type);

    Optional<GroupEntity> findBySlug(String slug);

    Optional<GroupEntity> findByIdAndActiveTrue(UUID id);
}
