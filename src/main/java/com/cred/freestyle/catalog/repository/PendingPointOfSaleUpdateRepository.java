package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.PendingPointOfSaleUpdate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for point of sale drafts, keyed by the point of sale ID.
 *
 * @author Catalog Team
 */
@Repository
public interface PendingPointOfSaleUpdateRepository extends JpaRepository<PendingPointOfSaleUpdate, Long> {
}
