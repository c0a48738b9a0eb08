package com.cred.freestyle.catalog.exception;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;

/**
 * Exception thrown when approving an aggregate that has no pending update.
 *
 * @author Catalog Team
 */
public class NoDraftFoundException extends RuntimeException {

    private final CatalogFamily family;
    private final Long aggregateId;

    public NoDraftFoundException(CatalogFamily family, Long aggregateId) {
        super(String.format("%s with ID %d has no pending update to approve", family.getDisplayName(), aggregateId));
        this.family = family;
        this.aggregateId = aggregateId;
    }

    public CatalogFamily getFamily() {
        return family;
    }

    public Long getAggregateId() {
        return aggregateId;
    }
}
