package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.domain.model.RevisionSnapshot;

/**
 * Outcome of a committed publish: the new revision and the revision it replaced.
 *
 * @param <R> Revision type
 * @author Catalog Team
 */
public class PublishedRevision<R extends RevisionSnapshot> {

    private final CatalogFamily family;
    private final R revision;
    private final Integer previousRevision;

    public PublishedRevision(CatalogFamily family, R revision, Integer previousRevision) {
        this.family = family;
        this.revision = revision;
        this.previousRevision = previousRevision;
    }

    public CatalogFamily getFamily() {
        return family;
    }

    public R getRevision() {
        return revision;
    }

    public Long getAggregateId() {
        return revision.getAggregateId();
    }

    public Integer getRevisionNumber() {
        return revision.getRevision();
    }

    /**
     * Revision that was current before this publish, null for a first publish.
     */
    public Integer getPreviousRevision() {
        return previousRevision;
    }

    public boolean isFirstRevision() {
        return previousRevision == null;
    }
}
