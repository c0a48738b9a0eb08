package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Identity record of a revisioned aggregate.
 * Holds the owner and the pointer to the currently published revision.
 *
 * A null currentRevision means the aggregate has never been published and only exists as a draft.
 * The pointer only moves forward, one revision at a time, together with the insert of the new revision row.
 *
 * @author Catalog Team
 */
@MappedSuperclass
@Getter
@Setter
@NoArgsConstructor
public abstract class RevisionedBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    /**
     * User or organization account owning this aggregate.
     */
    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    /**
     * Highest published revision, null until the first approval.
     */
    @Column(name = "current_revision")
    private Integer currentRevision;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Soft delete marker. Deleted aggregates keep their revisions for historical lookups.
     */
    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Version
    @Column(name = "version")
    private Long version;

    protected RevisionedBase(String ownerId) {
        this.ownerId = ownerId;
    }

    public boolean isPublished() {
        return currentRevision != null;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * Whether anyone may read this aggregate regardless of ownership.
     */
    public boolean isPubliclyVisible() {
        return false;
    }

    public int nextRevision() {
        return currentRevision == null ? 1 : currentRevision + 1;
    }

    /**
     * Move the current revision pointer forward by exactly one.
     *
     * @param revision Revision that was just inserted
     * @throws IllegalStateException if the revision is not the next one in sequence
     */
    public void advanceTo(int revision) {
        if (revision != nextRevision()) {
            throw new IllegalStateException(String.format(
                    "Cannot advance from revision %s to %d", currentRevision, revision));
        }
        this.currentRevision = revision;
    }

    public void markDeleted() {
        this.deletedAt = Instant.now();
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
