package com.cred.freestyle.catalog.repository;

import com.cred.freestyle.catalog.domain.model.RevisionedBase;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Common data access for aggregate base records.
 *
 * @param <B> Base record type
 * @author Catalog Team
 */
@NoRepositoryBean
public interface RevisionedBaseRepository<B extends RevisionedBase> extends JpaRepository<B, Long> {

    /**
     * Lock timeout applied to {@link #findByIdForUpdate(Long)}, in milliseconds.
     */
    String LOCK_TIMEOUT_MS = "3000";

    /**
     * Find a base record and hold a row lock on it until the surrounding transaction ends.
     * This serializes publishers of the same aggregate so revision numbers stay gap-free.
     *
     * @param id Aggregate ID
     * @return Optional containing the locked base record
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = LOCK_TIMEOUT_MS))
    @Query("SELECT b FROM #{#entityName} b WHERE b.id = :id")
    Optional<B> findByIdForUpdate(@Param("id") Long id);
}
