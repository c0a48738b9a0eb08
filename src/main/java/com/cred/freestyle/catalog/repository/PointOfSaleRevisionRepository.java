package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.ChildReference;
import com.cred.freestyle.catalog.domain.model.PointOfSaleRevision;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for point of sale revisions. Reference queries only consider each point of sale's current revision.
 *
 * @author Catalog Team
 */
@Repository
public interface PointOfSaleRevisionRepository extends RevisionSnapshotRepository<PointOfSaleRevision> {

    @Override
    @Query("SELECT r FROM PointOfSaleRevision r, PointOfSale s " +
           "WHERE s.id = r.aggregateId AND s.currentRevision = r.revision AND s.deletedAt IS NULL " +
           "ORDER BY r.aggregateId")
    List<PointOfSaleRevision> findAllCurrent();

    @Override
    @Query("SELECT r FROM PointOfSaleRevision r, PointOfSale s " +
           "WHERE s.id = r.aggregateId AND s.currentRevision = r.revision AND s.deletedAt IS NULL " +
           "AND s.ownerId = :ownerId " +
           "ORDER BY r.aggregateId")
    List<PointOfSaleRevision> findCurrentByOwner(@Param("ownerId") String ownerId);

    @Override
    @Query("SELECT DISTINCT r FROM PointOfSaleRevision r JOIN r.containerReferences ref, PointOfSale s " +
           "WHERE s.id = r.aggregateId AND s.currentRevision = r.revision AND s.deletedAt IS NULL " +
           "AND ref.childId = :containerId AND ref.childRevision = :containerRevision " +
           "ORDER BY r.aggregateId")
    List<PointOfSaleRevision> findCurrentReferencing(
            @Param("containerId") Long containerId,
            @Param("containerRevision") Integer containerRevision
    );

    @Override
    @Query("SELECT DISTINCT r FROM PointOfSaleRevision r JOIN r.containerReferences ref, PointOfSale s " +
           "WHERE s.id = r.aggregateId AND s.currentRevision = r.revision AND s.deletedAt IS NULL " +
           "AND ref.childId = :containerId " +
           "ORDER BY r.aggregateId")
    List<PointOfSaleRevision> findCurrentReferencingChild(@Param("containerId") Long containerId);

    @Override
    @Query("SELECT DISTINCT new com.cred.freestyle.catalog.domain.model.ChildReference(ref.childId, ref.childRevision) " +
           "FROM PointOfSaleRevision r JOIN r.containerReferences ref, PointOfSale s, Container c " +
           "WHERE s.id = r.aggregateId AND s.currentRevision = r.revision AND s.deletedAt IS NULL " +
           "AND c.id = ref.childId AND c.deletedAt IS NULL AND ref.childRevision < c.currentRevision")
    List<ChildReference> findStaleReferences();

    @Override
    @Query("SELECT DISTINCT ref.childId " +
           "FROM PointOfSaleRevision r JOIN r.containerReferences ref, PointOfSale s, Container c " +
           "WHERE s.id = r.aggregateId AND s.currentRevision = r.revision AND s.deletedAt IS NULL " +
           "AND c.id = ref.childId AND c.deletedAt IS NOT NULL")
    List<Long> findDeletedChildReferences();
}
