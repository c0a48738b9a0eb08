package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.domain.model.PendingRevision;
import com.cred.freestyle.catalog.domain.model.RevisionSnapshot;
import com.cred.freestyle.catalog.domain.model.RevisionedBase;
import com.cred.freestyle.catalog.exception.NoDraftFoundException;
import com.cred.freestyle.catalog.exception.PropagationPartialFailureException;
import com.cred.freestyle.catalog.exception.ResourceNotFoundException;
import com.cred.freestyle.catalog.infrastructure.cache.RevisionCacheService;
import com.cred.freestyle.catalog.infrastructure.messaging.CatalogEventPublisher;
import com.cred.freestyle.catalog.infrastructure.messaging.events.CatalogRevisionEvent;
import com.cred.freestyle.catalog.infrastructure.metrics.CatalogMetricsService;
import com.cred.freestyle.catalog.service.store.CatalogStores;
import com.cred.freestyle.catalog.service.store.RevisionedAggregateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Operations exposed for one aggregate family.
 *
 * Publishing flow:
 * 1. Commit the new revision (one transaction in {@link RevisionPublisher})
 * 2. Cache it, publish a change event, record metrics
 * 3. Propagate to parents that referenced the replaced revision
 *
 * A propagation failure never undoes step 1. It is reported to the caller as
 * {@link PropagationPartialFailureException} carrying the committed revision.
 *
 * @param <B> Base record type
 * @param <R> Revision type
 * @param <D> Draft type
 * @param <F> Editable field set
 * @author Catalog Team
 */
public abstract class RevisionedCatalogService<
        B extends RevisionedBase,
        R extends RevisionSnapshot,
        D extends PendingRevision,
        F> {

    private static final Logger logger = LoggerFactory.getLogger(RevisionedCatalogService.class);

    private final RevisionedAggregateStore<B, R, D, F> store;
    private final Class<R> revisionType;
    private final CatalogStores stores;
    private final RevisionPublisher publisher;
    private final PropagationEngine propagationEngine;
    private final RevisionCacheService cacheService;
    private final CatalogEventPublisher eventPublisher;
    private final CatalogMetricsService metricsService;

    protected RevisionedCatalogService(
            RevisionedAggregateStore<B, R, D, F> store,
            Class<R> revisionType,
            CatalogStores stores,
            RevisionPublisher publisher,
            PropagationEngine propagationEngine,
            RevisionCacheService cacheService,
            CatalogEventPublisher eventPublisher,
            CatalogMetricsService metricsService
    ) {
        this.store = store;
        this.revisionType = revisionType;
        this.stores = stores;
        this.publisher = publisher;
        this.propagationEngine = propagationEngine;
        this.cacheService = cacheService;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    public CatalogFamily family() {
        return store.family();
    }

    // ========================================
    // Drafts
    // ========================================

    /**
     * Create a new aggregate with an initial draft. Nothing is published.
     *
     * @param ownerId Owning user or organization
     * @param fields Initial field values
     * @param childIds Proposed children
     * @return ID of the new aggregate
     * @throws ResourceNotFoundException if a proposed child does not exist or was deleted
     */
    @Transactional
    public Long createDraft(String ownerId, F fields, List<Long> childIds) {
        List<Long> proposed = nullToEmpty(childIds);
        verifyChildrenExist(proposed);

        B base = store.createBase(ownerId);
        store.stage(base.getId(), fields, proposed);

        logger.info("Created {} {} for owner {} with draft", family().getDisplayName(), base.getId(), ownerId);
        return base.getId();
    }

    /**
     * Replace the draft of an existing aggregate.
     *
     * @throws ResourceNotFoundException if the aggregate or a proposed child does not exist
     */
    @Transactional
    public D stageUpdate(Long aggregateId, F fields, List<Long> childIds) {
        store.getBase(aggregateId);
        List<Long> proposed = nullToEmpty(childIds);
        verifyChildrenExist(proposed);

        D draft = store.stage(aggregateId, fields, proposed);
        logger.info("Staged update for {} {}", family().getDisplayName(), aggregateId);
        return draft;
    }

    /**
     * Get the draft of an aggregate with the revision each proposed child is at right now.
     */
    @Transactional(readOnly = true)
    public Optional<DraftView<D>> findDraft(Long aggregateId) {
        store.getBase(aggregateId);
        return store.findDraft(aggregateId).map(this::toDraftView);
    }

    /**
     * @throws NoDraftFoundException if the aggregate has no draft
     */
    @Transactional
    public void discardDraft(Long aggregateId) {
        store.getBase(aggregateId);
        if (!store.discard(aggregateId)) {
            throw new NoDraftFoundException(family(), aggregateId);
        }
        logger.info("Discarded draft of {} {}", family().getDisplayName(), aggregateId);
    }

    // ========================================
    // Publishing
    // ========================================

    /**
     * Publish the draft and propagate the new revision to parents.
     *
     * @return The committed revision
     * @throws NoDraftFoundException if there is nothing to approve
     * @throws PropagationPartialFailureException if some parents could not be republished
     */
    public R approve(Long aggregateId) {
        PublishedRevision<R> published = publisher.approve(store, aggregateId);
        return afterPublish(published, CatalogRevisionEvent.Cause.APPROVAL);
    }

    /**
     * Publish new field values directly, skipping the draft, and propagate to parents.
     *
     * @return The committed revision
     * @throws PropagationPartialFailureException if some parents could not be republished
     */
    public R publishDirect(Long aggregateId, F fields, List<Long> childIds) {
        PublishedRevision<R> published = publisher.publish(store, aggregateId, fields, nullToEmpty(childIds));
        return afterPublish(published, CatalogRevisionEvent.Cause.DIRECT);
    }

    /**
     * Soft-delete an aggregate and remove it from the current revision of its parents.
     *
     * @throws ResourceNotFoundException if the aggregate does not exist or is already deleted
     * @throws PropagationPartialFailureException if some parents could not be republished
     */
    public void softDelete(Long aggregateId) {
        B deleted = publisher.softDelete(store, aggregateId);
        eventPublisher.publish(CatalogRevisionEvent.deleted(family(), aggregateId, deleted.getCurrentRevision()));
        metricsService.recordAggregateDeleted(family());

        PropagationReport report = propagationEngine.propagateDeletion(family(), aggregateId);
        if (report.hasFailures()) {
            throw new PropagationPartialFailureException(family(), aggregateId, null, report);
        }
    }

    private R afterPublish(PublishedRevision<R> published, CatalogRevisionEvent.Cause cause) {
        R revision = published.getRevision();
        cacheService.cacheRevision(family(), revision);
        eventPublisher.publish(CatalogRevisionEvent.published(
                family(),
                published.getAggregateId(),
                published.getRevisionNumber(),
                published.getPreviousRevision(),
                cause
        ));
        metricsService.recordRevisionPublished(family(), cause);

        if (published.isFirstRevision()) {
            return revision;
        }

        PropagationReport report = propagationEngine.propagate(
                family(), published.getAggregateId(), published.getPreviousRevision());
        if (report.hasFailures()) {
            throw new PropagationPartialFailureException(
                    family(), published.getAggregateId(), published.getRevisionNumber(), report);
        }
        return revision;
    }

    // ========================================
    // Reads
    // ========================================

    /**
     * Get a live base record.
     *
     * @throws ResourceNotFoundException if unknown or deleted
     */
    @Transactional(readOnly = true)
    public B getBase(Long aggregateId) {
        return store.getBase(aggregateId);
    }

    /**
     * Get a base record even if it was soft-deleted, for historical lookups.
     */
    @Transactional(readOnly = true)
    public B getBaseIncludingDeleted(Long aggregateId) {
        return store.findBase(aggregateId)
                .orElseThrow(() -> new ResourceNotFoundException(family().getDisplayName(), String.valueOf(aggregateId)));
    }

    /**
     * Get the revision the base pointer designates.
     *
     * @throws ResourceNotFoundException if unknown, deleted or never published
     */
    @Transactional(readOnly = true)
    public R getCurrent(Long aggregateId) {
        B base = store.getPublishedBase(aggregateId);
        return loadRevision(base, base.getCurrentRevision());
    }

    /**
     * Get a historical revision. The same (id, revision) always returns the same content.
     *
     * @throws ResourceNotFoundException if the revision was never published
     */
    @Transactional(readOnly = true)
    public R getRevision(Long aggregateId, int revision) {
        B base = getBaseIncludingDeleted(aggregateId);
        if (!base.isPublished() || revision < 1 || revision > base.getCurrentRevision()) {
            throw new ResourceNotFoundException(family().getDisplayName(), aggregateId, revision);
        }
        return loadRevision(base, revision);
    }

    @Transactional(readOnly = true)
    public List<R> listRevisions(Long aggregateId) {
        return store.listRevisions(aggregateId);
    }

    /**
     * Current revisions of all live, published aggregates, optionally of one owner.
     */
    @Transactional(readOnly = true)
    public List<R> listCurrent(String ownerId) {
        return store.listCurrent(ownerId);
    }

    private R loadRevision(B base, int revision) {
        String cacheType = family().name().toLowerCase() + "_revision";
        Optional<R> cached = cacheService.getRevision(family(), base.getId(), revision, revisionType);
        if (cached.isPresent()) {
            metricsService.recordCacheHit(cacheType);
            return cached.get();
        }

        metricsService.recordCacheMiss(cacheType);
        R loaded = store.getRevision(base.getId(), revision);
        cacheService.cacheRevision(family(), loaded);
        return loaded;
    }

    // ========================================
    // Helpers
    // ========================================

    private void verifyChildrenExist(List<Long> childIds) {
        if (childIds.isEmpty()) {
            return;
        }
        CatalogFamily childFamily = family().child().orElseThrow(() ->
                new IllegalArgumentException(family().getDisplayName() + " cannot reference other aggregates"));
        RevisionedAggregateStore<?, ?, ?, ?> childStore = stores.forFamily(childFamily);
        for (Long childId : childIds) {
            childStore.getBase(childId);
        }
    }

    private DraftView<D> toDraftView(D draft) {
        List<DraftView.ProposedChild> children = new ArrayList<>();
        Optional<CatalogFamily> childFamily = family().child();
        if (childFamily.isPresent()) {
            RevisionedAggregateStore<?, ?, ?, ?> childStore = stores.forFamily(childFamily.get());
            for (Long childId : draft.getProposedChildIds()) {
                Integer currentRevision = childStore.findBase(childId)
                        .filter(child -> !child.isDeleted())
                        .map(RevisionedBase::getCurrentRevision)
                        .orElse(null);
                children.add(new DraftView.ProposedChild(childId, currentRevision));
            }
        }
        return new DraftView<>(draft, children);
    }

    private static List<Long> nullToEmpty(List<Long> childIds) {
        return childIds == null ? Collections.emptyList() : childIds;
    }
}
