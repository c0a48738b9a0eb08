package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.DeactivatedOwner;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for deactivated owner accounts.
 *
 * @author Catalog Team
 */
@Repository
public interface DeactivatedOwnerRepository extends JpaRepository<DeactivatedOwner, String> {
}
