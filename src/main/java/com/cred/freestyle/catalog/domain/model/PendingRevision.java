package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Unapproved draft of the next revision of an aggregate. At most one per base record.
 *
 * Proposed children are stored by aggregate id only; they are bound to a concrete
 * child revision when the draft is approved.
 *
 * @author Catalog Team
 */
@MappedSuperclass
@Getter
@Setter
@NoArgsConstructor
public abstract class PendingRevision {

    @Column(name = "name", nullable = false, length = 64)
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public abstract Long getAggregateId();

    public List<Long> getProposedChildIds() {
        return Collections.emptyList();
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
