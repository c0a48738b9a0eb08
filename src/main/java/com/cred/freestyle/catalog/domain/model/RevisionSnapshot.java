package com.cred.freestyle.catalog.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of an aggregate at one revision.
 *
 * Rows are only ever inserted. A new instance always reports itself as new so that
 * saving it issues an INSERT; a duplicate (aggregateId, revision) key then fails
 * instead of being merged into the existing row.
 *
 * @author Catalog Team
 */
@MappedSuperclass
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(value = {"id", "new", "childReferences"}, ignoreUnknown = true)
public abstract class RevisionSnapshot implements Persistable<RevisionKey> {

    @Column(name = "name", nullable = false, length = 64)
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean newRevision = true;

    public abstract Long getAggregateId();

    public abstract Integer getRevision();

    /**
     * Child revisions this snapshot was published against. Empty for families without children.
     */
    public List<ChildReference> getChildReferences() {
        return Collections.emptyList();
    }

    @Override
    public RevisionKey getId() {
        return new RevisionKey(getAggregateId(), getRevision());
    }

    @Override
    public boolean isNew() {
        return newRevision;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PostPersist
    @PostLoad
    protected void markPersisted() {
        newRevision = false;
    }
}
