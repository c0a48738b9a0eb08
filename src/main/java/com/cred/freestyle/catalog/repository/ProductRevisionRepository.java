package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.ProductRevision;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for product revisions. Products have no children, so the reference queries keep their defaults.
 *
 * @author Catalog Team
 */
@Repository
public interface ProductRevisionRepository extends RevisionSnapshotRepository<ProductRevision> {

    @Override
    @Query("SELECT r FROM ProductRevision r, Product p " +
           "WHERE p.id = r.aggregateId AND p.currentRevision = r.revision AND p.deletedAt IS NULL " +
           "ORDER BY r.aggregateId")
    List<ProductRevision> findAllCurrent();

    @Override
    @Query("SELECT r FROM ProductRevision r, Product p " +
           "WHERE p.id = r.aggregateId AND p.currentRevision = r.revision AND p.deletedAt IS NULL " +
           "AND p.ownerId = :ownerId " +
           "ORDER BY r.aggregateId")
    List<ProductRevision> findCurrentByOwner(@Param("ownerId") String ownerId);
}
