package com.cred.freestyle.catalog.service.store;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.domain.model.ChildReference;
import com.cred.freestyle.catalog.domain.model.PendingRevision;
import com.cred.freestyle.catalog.domain.model.RevisionSnapshot;
import com.cred.freestyle.catalog.domain.model.RevisionedBase;
import com.cred.freestyle.catalog.exception.ResourceNotFoundException;
import com.cred.freestyle.catalog.repository.RevisionSnapshotRepository;
import com.cred.freestyle.catalog.repository.RevisionedBaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Storage for one revisioned aggregate family: base records, immutable revisions and drafts.
 *
 * The store performs no transaction management of its own. Callers that combine several
 * operations into one atomic unit (the revision publisher) run them inside their transaction.
 *
 * @param <B> Base record type
 * @param <R> Revision type
 * @param <D> Draft type
 * @param <F> Editable field set
 * @author Catalog Team
 */
public abstract class RevisionedAggregateStore<
        B extends RevisionedBase,
        R extends RevisionSnapshot,
        D extends PendingRevision,
        F> {

    private static final Logger logger = LoggerFactory.getLogger(RevisionedAggregateStore.class);

    private final CatalogFamily family;
    private final RevisionedBaseRepository<B> baseRepository;
    private final RevisionSnapshotRepository<R> revisionRepository;
    private final JpaRepository<D, Long> pendingRepository;

    protected RevisionedAggregateStore(
            CatalogFamily family,
            RevisionedBaseRepository<B> baseRepository,
            RevisionSnapshotRepository<R> revisionRepository,
            JpaRepository<D, Long> pendingRepository
    ) {
        this.family = family;
        this.baseRepository = baseRepository;
        this.revisionRepository = revisionRepository;
        this.pendingRepository = pendingRepository;
    }

    protected abstract B newBase(String ownerId);

    protected abstract R newRevision(Long aggregateId, int revision, F fields, List<ChildReference> childReferences);

    protected abstract D newDraft(Long aggregateId);

    protected abstract void writeDraft(D draft, F fields, List<Long> childIds);

    /**
     * Field values carried by a published revision, used when a parent is republished unchanged.
     */
    public abstract F fieldsOf(B base, R revision);

    public abstract F fieldsOf(D draft);

    /**
     * Write fields that live on the base record rather than on the revision.
     */
    public void applyToBase(B base, F fields) {
    }

    public CatalogFamily family() {
        return family;
    }

    // ========================================
    // Base records
    // ========================================

    public B createBase(String ownerId) {
        B base = baseRepository.save(newBase(ownerId));
        logger.info("Created {} base {} for owner {}", family.getDisplayName(), base.getId(), ownerId);
        return base;
    }

    /**
     * Find a base record, including soft-deleted ones.
     */
    public Optional<B> findBase(Long aggregateId) {
        return baseRepository.findById(aggregateId);
    }

    /**
     * Get a live base record.
     *
     * @throws ResourceNotFoundException if the id is unknown or the aggregate was deleted
     */
    public B getBase(Long aggregateId) {
        return findBase(aggregateId)
                .filter(base -> !base.isDeleted())
                .orElseThrow(() -> notFound(aggregateId));
    }

    /**
     * Get a live base record and hold its row lock until the current transaction ends.
     *
     * @throws ResourceNotFoundException if the id is unknown or the aggregate was deleted
     */
    public B lockBase(Long aggregateId) {
        return lockBaseIfPresent(aggregateId)
                .filter(base -> !base.isDeleted())
                .orElseThrow(() -> notFound(aggregateId));
    }

    public Optional<B> lockBaseIfPresent(Long aggregateId) {
        return baseRepository.findByIdForUpdate(aggregateId);
    }

    public B saveBase(B base) {
        return baseRepository.saveAndFlush(base);
    }

    // ========================================
    // Revisions
    // ========================================

    /**
     * Get a live base that has a current revision.
     *
     * @throws ResourceNotFoundException if the aggregate is unknown, deleted or never published
     */
    public B getPublishedBase(Long aggregateId) {
        B base = getBase(aggregateId);
        if (!base.isPublished()) {
            throw notFound(aggregateId);
        }
        return base;
    }

    /**
     * Get a historical revision. Revisions of deleted aggregates stay readable.
     *
     * @throws ResourceNotFoundException if the id is unknown or the revision was never published
     */
    public R getRevision(Long aggregateId, int revision) {
        B base = findBase(aggregateId).orElseThrow(() -> notFound(aggregateId));
        if (!base.isPublished() || revision < 1 || revision > base.getCurrentRevision()) {
            throw new ResourceNotFoundException(family.getDisplayName(), aggregateId, revision);
        }
        return findRevision(aggregateId, revision);
    }

    public List<R> listRevisions(Long aggregateId) {
        findBase(aggregateId).orElseThrow(() -> notFound(aggregateId));
        return revisionRepository.findByAggregateIdOrderByRevisionAsc(aggregateId);
    }

    public List<R> listCurrent(String ownerId) {
        if (ownerId == null) {
            return revisionRepository.findAllCurrent();
        }
        return revisionRepository.findCurrentByOwner(ownerId);
    }

    /**
     * Insert a new revision row. Never updates an existing row.
     */
    public R insertRevision(Long aggregateId, int revision, F fields, List<ChildReference> childReferences) {
        R saved = revisionRepository.saveAndFlush(newRevision(aggregateId, revision, fields, childReferences));
        logger.debug("Inserted {} {} revision {} with {} child reference(s)",
                family.getDisplayName(), aggregateId, revision, childReferences.size());
        return saved;
    }

    public List<R> findCurrentReferencing(Long childId, int childRevision) {
        return revisionRepository.findCurrentReferencing(childId, childRevision);
    }

    public List<R> findCurrentReferencingChild(Long childId) {
        return revisionRepository.findCurrentReferencingChild(childId);
    }

    public List<ChildReference> findStaleReferences() {
        return revisionRepository.findStaleReferences();
    }

    public List<Long> findDeletedChildReferences() {
        return revisionRepository.findDeletedChildReferences();
    }

    // ========================================
    // Drafts
    // ========================================

    /**
     * Create or replace the draft of an aggregate. The previous draft is overwritten wholesale.
     */
    public D stage(Long aggregateId, F fields, List<Long> childIds) {
        D draft = pendingRepository.findById(aggregateId).orElseGet(() -> newDraft(aggregateId));
        writeDraft(draft, fields, childIds);
        D saved = pendingRepository.save(draft);
        logger.debug("Staged draft for {} {} with {} child id(s)", family.getDisplayName(), aggregateId, childIds.size());
        return saved;
    }

    public Optional<D> findDraft(Long aggregateId) {
        return pendingRepository.findById(aggregateId);
    }

    /**
     * Delete the draft of an aggregate.
     *
     * @return true if a draft existed
     */
    public boolean discard(Long aggregateId) {
        if (!pendingRepository.existsById(aggregateId)) {
            return false;
        }
        pendingRepository.deleteById(aggregateId);
        logger.debug("Discarded draft for {} {}", family.getDisplayName(), aggregateId);
        return true;
    }

    private R findRevision(Long aggregateId, int revision) {
        return revisionRepository.findByAggregateIdAndRevision(aggregateId, revision)
                .orElseThrow(() -> new ResourceNotFoundException(family.getDisplayName(), aggregateId, revision));
    }

    private ResourceNotFoundException notFound(Long aggregateId) {
        return new ResourceNotFoundException(family.getDisplayName(), String.valueOf(aggregateId));
    }
}
