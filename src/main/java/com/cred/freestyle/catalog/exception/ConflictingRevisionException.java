package com.cred.freestyle.catalog.exception;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;

/**
 * Exception thrown when a publish lost the race for the next revision number of an aggregate.
 * Nothing was written; the caller may retry once.
 *
 * @author Catalog Team
 */
public class ConflictingRevisionException extends RuntimeException {

    private final CatalogFamily family;
    private final Long aggregateId;

    public ConflictingRevisionException(CatalogFamily family, Long aggregateId, Throwable cause) {
        super(String.format("Concurrent publish on %s with ID %d, retry the request",
                family.getDisplayName(), aggregateId), cause);
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
