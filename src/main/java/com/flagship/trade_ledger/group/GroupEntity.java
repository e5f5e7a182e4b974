package com.flagship.trade_ledger.group;

import com.flagship.trade_ledger.support.Slugs;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "account_groups",
    indexes = {
        @Index(name = "idx_account_groups_parent", columnList = "parent_group_id"),
        @Index(name = "idx_account_groups_type", columnList = "type")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class GroupEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(nullable = false, unique = true, length = 120)
    private String slug;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private GroupType type;

    @Column(name = "parent_group_id")
    private UUID parentGroupId;

    @Column(name = "is_predefined", nullable = false, updatable = false)
    private boolean predefined;

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

    private GroupEntity(String name, GroupType type, UUID parentGroupId, boolean predefined, String actor) {
        this.id = UUID.randomUUID();
        this.name = name.trim();
        this.slug = Slugs.slugify(name);
        this.type = type;
        this.parentGroupId = parentGroupId;
        this.predefined = predefined;
        this.active = true;
        this.createdBy = actor;
        this.updatedBy = actor;
    }

    public static GroupEntity create(String name, GroupType type, UUID parentGroupId, String actor) {
        return new GroupEntity(name, type, parentGroupId, false, actor);
    }

    static GroupEntity predefined(String name, GroupType type, UUID parentGroupId, String actor) {
        return new GroupEntity(name, type, parentGroupId, true, actor);
    }

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
     * Hierarchy checks happen in {@link GroupService} before this is called.
     */
    void moveUnder(UUID newParentGroupId, String actor) {
        this.parentGroupId = newParentGroupId;
        this.updatedBy = actor;
    }

    public Group toDomain() {
        return new Group(id, name, slug, type, parentGroupId, predefined);
    }
}
