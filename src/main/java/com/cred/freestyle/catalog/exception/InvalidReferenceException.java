package com.cred.freestyle.catalog.exception;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;

/**
 * Exception thrown when a publish lists a child that cannot be bound to a revision:
 * the child does not exist, was deleted, or has never been published.
 *
 * @author Catalog Team
 */
public class InvalidReferenceException extends RuntimeException {

    private final CatalogFamily childFamily;
    private final Long childId;

    public InvalidReferenceException(CatalogFamily childFamily, Long childId, String reason) {
        super(String.format("Cannot reference %s with ID %d: %s", childFamily.getDisplayName(), childId, reason));
        this.childFamily = childFamily;
        this.childId = childId;
    }

    public CatalogFamily getChildFamily() {
        return childFamily;
    }

    public Long getChildId() {
        return childId;
    }
}
