package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.ChildReference;
import com.cred.freestyle.catalog.domain.model.RevisionKey;
import com.cred.freestyle.catalog.domain.model.RevisionSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Common data access for immutable revision rows.
 *
 * Concrete repositories redeclare these methods with their JPQL. The reference query
 * defaults describe a family without children.
 *
 * @param <R> Revision type
 * @author Catalog Team
 */
@NoRepositoryBean
public interface RevisionSnapshotRepository<R extends RevisionSnapshot> extends JpaRepository<R, RevisionKey> {

    Optional<R> findByAggregateIdAndRevision(Long aggregateId, Integer revision);

    List<R> findByAggregateIdOrderByRevisionAsc(Long aggregateId);

    /**
     * Current revisions of all live aggregates.
     *
     * @return Revisions ordered by aggregate id
     */
    default List<R> findAllCurrent() {
        throw new UnsupportedOperationException("findAllCurrent is not declared for this revision type");
    }

    /**
     * Current revisions of the live aggregates of one owner.
     *
     * @param ownerId Owner ID
     * @return Revisions ordered by aggregate id
     */
    default List<R> findCurrentByOwner(String ownerId) {
        throw new UnsupportedOperationException("findCurrentByOwner is not declared for this revision type");
    }

    /**
     * Revisions that are the current revision of a live aggregate and reference the given child revision.
     *
     * @param childId Child aggregate ID
     * @param childRevision Child revision number
     * @return Matching revisions ordered by aggregate id
     */
    default List<R> findCurrentReferencing(Long childId, Integer childRevision) {
        return Collections.emptyList();
    }

    /**
     * Revisions that are the current revision of a live aggregate and reference any revision of the given child.
     *
     * @param childId Child aggregate ID
     * @return Matching revisions ordered by aggregate id
     */
    default List<R> findCurrentReferencingChild(Long childId) {
        return Collections.emptyList();
    }

    /**
     * References held by current revisions that point at an older revision of a live child.
     *
     * @return Stale references, one per distinct (child, revision)
     */
    default List<ChildReference> findStaleReferences() {
        return Collections.emptyList();
    }

    /**
     * IDs of soft-deleted children still referenced by a current revision.
     *
     * @return Child aggregate IDs
     */
    default List<Long> findDeletedChildReferences() {
        return Collections.emptyList();
    }
}
