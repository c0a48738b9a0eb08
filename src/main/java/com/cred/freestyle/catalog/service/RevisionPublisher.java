package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.domain.model.ChildReference;
import com.cred.freestyle.catalog.domain.model.PendingRevision;
import com.cred.freestyle.catalog.domain.model.RevisionSnapshot;
import com.cred.freestyle.catalog.domain.model.RevisionedBase;
import com.cred.freestyle.catalog.exception.ConflictingRevisionException;
import com.cred.freestyle.catalog.exception.InvalidReferenceException;
import com.cred.freestyle.catalog.exception.NoDraftFoundException;
import com.cred.freestyle.catalog.infrastructure.metrics.CatalogMetricsService;
import com.cred.freestyle.catalog.service.store.CatalogStores;
import com.cred.freestyle.catalog.service.store.RevisionedAggregateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Turns drafts and direct updates into new immutable revisions.
 *
 * Every public method is one database transaction:
 * 1. Lock the base row (serializes publishers of the same aggregate)
 * 2. Compute nextRevision = (currentRevision ?? 0) + 1
 * 3. Bind child ids to each child's current revision at this instant
 * 4. Insert the revision row
 * 5. Advance the base pointer and delete the draft
 *
 * Either all of it commits or none of it does. Propagation to parents is not part of
 * the transaction; callers start it after commit.
 *
 * Lock timeouts, duplicate revision keys and optimistic version failures surface as
 * {@link ConflictingRevisionException}. Other integrity violations are rethrown as they are.
 *
 * @author Catalog Team
 */
@Service
public class RevisionPublisher {

    private static final Logger logger = LoggerFactory.getLogger(RevisionPublisher.class);

    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final CatalogStores stores;
    private final VisibilityResolver visibilityResolver;
    private final CatalogMetricsService metricsService;

    public RevisionPublisher(
            CatalogStores stores,
            VisibilityResolver visibilityResolver,
            CatalogMetricsService metricsService
    ) {
        this.stores = stores;
        this.visibilityResolver = visibilityResolver;
        this.metricsService = metricsService;
    }

    /**
     * Publish a new revision with the given fields, bypassing the draft.
     * An existing draft is discarded.
     *
     * @param store Store of the aggregate family
     * @param aggregateId Aggregate ID
     * @param fields New field values
     * @param childIds Children to reference, bound to their current revisions now
     * @return The committed revision
     */
    @Transactional
    public <B extends RevisionedBase, R extends RevisionSnapshot, D extends PendingRevision, F>
    PublishedRevision<R> publish(
            RevisionedAggregateStore<B, R, D, F> store,
            Long aggregateId,
            F fields,
            List<Long> childIds
    ) {
        try {
            B base = store.lockBase(aggregateId);
            List<ChildReference> childReferences = resolveChildren(store.family(), childIds);
            return writeRevision(store, base, fields, childReferences);
        } catch (ConcurrencyFailureException e) {
            throw conflict(store.family(), aggregateId, e);
        } catch (DataIntegrityViolationException e) {
            throw conflictOrRethrow(store.family(), aggregateId, e);
        }
    }

    /**
     * Publish the draft of an aggregate. Children are bound at approval time, not at staging time.
     *
     * @throws NoDraftFoundException if the aggregate has no draft
     */
    @Transactional
    public <B extends RevisionedBase, R extends RevisionSnapshot, D extends PendingRevision, F>
    PublishedRevision<R> approve(RevisionedAggregateStore<B, R, D, F> store, Long aggregateId) {
        try {
            B base = store.lockBase(aggregateId);
            D draft = store.findDraft(aggregateId)
                    .orElseThrow(() -> new NoDraftFoundException(store.family(), aggregateId));
            List<ChildReference> childReferences =
                    resolveChildren(store.family(), new ArrayList<>(draft.getProposedChildIds()));
            return writeRevision(store, base, store.fieldsOf(draft), childReferences);
        } catch (ConcurrencyFailureException e) {
            throw conflict(store.family(), aggregateId, e);
        } catch (DataIntegrityViolationException e) {
            throw conflictOrRethrow(store.family(), aggregateId, e);
        }
    }

    /**
     * Soft-delete an aggregate and drop its draft. Revisions are kept for historical lookups.
     *
     * @return The deleted base record
     */
    @Transactional
    public <B extends RevisionedBase, R extends RevisionSnapshot, D extends PendingRevision, F>
    B softDelete(RevisionedAggregateStore<B, R, D, F> store, Long aggregateId) {
        try {
            B base = store.lockBase(aggregateId);
            base.markDeleted();
            store.discard(aggregateId);
            B saved = store.saveBase(base);
            logger.info("Soft-deleted {} {} at revision {}",
                    store.family().getDisplayName(), aggregateId, saved.getCurrentRevision());
            return saved;
        } catch (ConcurrencyFailureException e) {
            throw conflict(store.family(), aggregateId, e);
        }
    }

    /**
     * Republish a parent with one child reference moved to a newer child revision.
     *
     * The parent's current revision is re-read under its row lock. Nothing is written if the
     * parent no longer references (childId, previousChildRevision) at its current revision,
     * or if it is not a propagation target. Like any publish, it drops the parent's draft.
     *
     * @return The committed parent revision, empty if the parent was skipped
     */
    @Transactional
    public Optional<PublishedRevision<?>> republishWithSubstitution(
            CatalogFamily parentFamily,
            Long parentId,
            Long childId,
            int previousChildRevision,
            int newChildRevision
    ) {
        ChildReference stale = new ChildReference(childId, previousChildRevision);
        ChildReference fresh = new ChildReference(childId, newChildRevision);

        return republish(stores.forFamily(parentFamily), parentId,
                references -> references.contains(stale),
                references -> references.stream()
                        .map(reference -> reference.equals(stale) ? fresh : reference)
                        .collect(Collectors.toList()));
    }

    /**
     * Republish a parent with every reference to a deleted child removed.
     *
     * @return The committed parent revision, empty if the parent was skipped
     */
    @Transactional
    public Optional<PublishedRevision<?>> republishWithout(CatalogFamily parentFamily, Long parentId, Long childId) {
        return republish(stores.forFamily(parentFamily), parentId,
                references -> references.stream().anyMatch(reference -> reference.refersTo(childId)),
                references -> references.stream()
                        .filter(reference -> !reference.refersTo(childId))
                        .collect(Collectors.toList()));
    }

    private <B extends RevisionedBase, R extends RevisionSnapshot, D extends PendingRevision, F>
    Optional<PublishedRevision<?>> republish(
            RevisionedAggregateStore<B, R, D, F> store,
            Long parentId,
            Predicate<List<ChildReference>> affected,
            UnaryOperator<List<ChildReference>> edit
    ) {
        CatalogFamily family = store.family();
        try {
            Optional<B> locked = store.lockBaseIfPresent(parentId);
            if (locked.isEmpty()) {
                logger.warn("{} {} no longer exists, skipping", family.getDisplayName(), parentId);
                return Optional.empty();
            }

            B base = locked.get();
            if (!base.isPublished() || !visibilityResolver.isPropagationTarget(base)) {
                logger.info("{} {} is not a propagation target, skipping", family.getDisplayName(), parentId);
                return Optional.empty();
            }

            R current = store.getRevision(parentId, base.getCurrentRevision());
            List<ChildReference> references = new ArrayList<>(current.getChildReferences());
            if (!affected.test(references)) {
                logger.debug("{} {} revision {} no longer holds the reference, skipping",
                        family.getDisplayName(), parentId, current.getRevision());
                return Optional.empty();
            }

            return Optional.of(writeRevision(store, base, store.fieldsOf(base, current), edit.apply(references)));
        } catch (ConcurrencyFailureException e) {
            throw conflict(family, parentId, e);
        } catch (DataIntegrityViolationException e) {
            throw conflictOrRethrow(family, parentId, e);
        }
    }

    private <B extends RevisionedBase, R extends RevisionSnapshot, D extends PendingRevision, F>
    PublishedRevision<R> writeRevision(
            RevisionedAggregateStore<B, R, D, F> store,
            B base,
            F fields,
            List<ChildReference> childReferences
    ) {
        Integer previousRevision = base.getCurrentRevision();
        int nextRevision = base.nextRevision();

        R revision = store.insertRevision(base.getId(), nextRevision, fields, childReferences);
        store.applyToBase(base, fields);
        base.advanceTo(nextRevision);
        store.saveBase(base);
        if (store.discard(base.getId())) {
            logger.info("Dropped pending update of {} {} superseded by revision {}",
                    store.family().getDisplayName(), base.getId(), nextRevision);
        }

        logger.info("Published {} {} revision {} (previous: {})",
                store.family().getDisplayName(), base.getId(), nextRevision, previousRevision);
        return new PublishedRevision<>(store.family(), revision, previousRevision);
    }

    /**
     * Bind each child id to the child's current revision.
     * Children must exist, be live and have at least one published revision.
     */
    private List<ChildReference> resolveChildren(CatalogFamily family, List<Long> childIds) {
        List<ChildReference> childReferences = new ArrayList<>();
        if (childIds == null || childIds.isEmpty()) {
            return childReferences;
        }

        CatalogFamily childFamily = family.child().orElseThrow(() ->
                new IllegalArgumentException(family.getDisplayName() + " cannot reference other aggregates"));
        RevisionedAggregateStore<?, ?, ?, ?> childStore = stores.forFamily(childFamily);

        for (Long childId : childIds) {
            RevisionedBase child = childStore.findBase(childId)
                    .orElseThrow(() -> new InvalidReferenceException(childFamily, childId, "it does not exist"));
            if (child.isDeleted()) {
                throw new InvalidReferenceException(childFamily, childId, "it has been deleted");
            }
            if (!child.isPublished()) {
                throw new InvalidReferenceException(childFamily, childId, "it has never been published");
            }
            childReferences.add(new ChildReference(childId, child.getCurrentRevision()));
        }
        return childReferences;
    }

    /**
     * A duplicate (aggregate, revision) key means a competing publisher inserted the row first.
     * Any other integrity violation is not a conflict and is rethrown unchanged.
     */
    private RuntimeException conflictOrRethrow(CatalogFamily family, Long aggregateId,
                                               DataIntegrityViolationException e) {
        if (isDuplicateKey(e)) {
            return conflict(family, aggregateId, e);
        }
        return e;
    }

    private static boolean isDuplicateKey(DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException
                    && UNIQUE_VIOLATION_SQL_STATE.equals(((SQLException) cause).getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private ConflictingRevisionException conflict(CatalogFamily family, Long aggregateId, RuntimeException cause) {
        logger.warn("Publish conflict on {} {}: {}", family.getDisplayName(), aggregateId, cause.getMessage());
        metricsService.recordPublishConflict(family);
        return new ConflictingRevisionException(family, aggregateId, cause);
    }
}
