package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.PendingContainerUpdate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for container drafts, keyed by the container ID.
 *
 * @author Catalog Team
 */
@Repository
public interface PendingContainerUpdateRepository extends JpaRepository<PendingContainerUpdate, Long> {
}
