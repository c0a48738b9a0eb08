package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.PointOfSale;
import org.springframework.stereotype.Repository;

/**
 * Repository for point of sale base records.
 *
 * @author Catalog Team
 */
@Repository
public interface PointOfSaleRepository extends RevisionedBaseRepository<PointOfSale> {
}
