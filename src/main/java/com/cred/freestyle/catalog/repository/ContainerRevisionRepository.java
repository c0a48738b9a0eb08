package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.ChildReference;
import com.cred.freestyle.catalog.domain.model.ContainerRevision;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for container revisions.
 *
 * Every reference query joins the container base and keeps only rows at the container's own
 * current revision. Older container revisions are history and are never propagation targets.
 *
 * @author Catalog Team
 */
@Repository
public interface ContainerRevisionRepository extends RevisionSnapshotRepository<ContainerRevision> {

    @Override
    @Query("SELECT r FROM ContainerRevision r, Container c " +
           "WHERE c.id = r.aggregateId AND c.currentRevision = r.revision AND c.deletedAt IS NULL " +
           "ORDER BY r.aggregateId")
    List<ContainerRevision> findAllCurrent();

    @Override
    @Query("SELECT r FROM ContainerRevision r, Container c " +
           "WHERE c.id = r.aggregateId AND c.currentRevision = r.revision AND c.deletedAt IS NULL " +
           "AND c.ownerId = :ownerId " +
           "ORDER BY r.aggregateId")
    List<ContainerRevision> findCurrentByOwner(@Param("ownerId") String ownerId);

    @Override
    @Query("SELECT DISTINCT r FROM ContainerRevision r JOIN r.productReferences ref, Container c " +
           "WHERE c.id = r.aggregateId AND c.currentRevision = r.revision AND c.deletedAt IS NULL " +
           "AND ref.childId = :productId AND ref.childRevision = :productRevision " +
           "ORDER BY r.aggregateId")
    List<ContainerRevision> findCurrentReferencing(
            @Param("productId") Long productId,
            @Param("productRevision") Integer productRevision
    );

    @Override
    @Query("SELECT DISTINCT r FROM ContainerRevision r JOIN r.productReferences ref, Container c " +
           "WHERE c.id = r.aggregateId AND c.currentRevision = r.revision AND c.deletedAt IS NULL " +
           "AND ref.childId = :productId " +
           "ORDER BY r.aggregateId")
    List<ContainerRevision> findCurrentReferencingChild(@Param("productId") Long productId);

    @Override
    @Query("SELECT DISTINCT new com.cred.freestyle.catalog.domain.model.ChildReference(ref.childId, ref.childRevision) " +
           "FROM ContainerRevision r JOIN r.productReferences ref, Container c, Product p " +
           "WHERE c.id = r.aggregateId AND c.currentRevision = r.revision AND c.deletedAt IS NULL " +
           "AND p.id = ref.childId AND p.deletedAt IS NULL AND ref.childRevision < p.currentRevision")
    List<ChildReference> findStaleReferences();

    @Override
    @Query("SELECT DISTINCT ref.childId " +
           "FROM ContainerRevision r JOIN r.productReferences ref, Container c, Product p " +
           "WHERE c.id = r.aggregateId AND c.currentRevision = r.revision AND c.deletedAt IS NULL " +
           "AND p.id = ref.childId AND p.deletedAt IS NOT NULL")
    List<Long> findDeletedChildReferences();
}
