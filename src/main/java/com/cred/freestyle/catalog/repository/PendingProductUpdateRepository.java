package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.PendingProductUpdate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for product drafts, keyed by the product ID.
 *
 * @author Catalog Team
 */
@Repository
public interface PendingProductUpdateRepository extends JpaRepository<PendingProductUpdate, Long> {
}
