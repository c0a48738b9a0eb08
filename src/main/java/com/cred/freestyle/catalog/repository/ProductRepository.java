package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.Product;
import org.springframework.stereotype.Repository;

/**
 * Repository for product base records.
 *
 * @author Catalog Team
 */
@Repository
public interface ProductRepository extends RevisionedBaseRepository<Product> {
}
