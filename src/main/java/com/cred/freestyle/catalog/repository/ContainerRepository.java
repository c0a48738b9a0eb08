package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.Container;
import org.springframework.stereotype.Repository;

/**
 * Repository for container base records.
 *
 * @author Catalog Team
 */
@Repository
public interface ContainerRepository extends RevisionedBaseRepository<Container> {
}
