package com.cred.freestyle.catalog.exception;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.service.PropagationReport;

/**
 * Exception thrown after a successful publish when one or more parents could not be republished.
 *
 * The revision of the aggregate itself is committed and stays committed. Parents that failed
 * keep their previous revision until they are published again or repaired.
 *
 * @author Catalog Team
 */
public class PropagationPartialFailureException extends RuntimeException {

    private final CatalogFamily family;
    private final Long aggregateId;
    private final Integer committedRevision;
    private final transient PropagationReport report;

    public PropagationPartialFailureException(
            CatalogFamily family,
            Long aggregateId,
            Integer committedRevision,
            PropagationReport report
    ) {
        super(String.format("%s with ID %d was committed at revision %s but %d parent update(s) failed",
                family.getDisplayName(), aggregateId, committedRevision, report.getFailures().size()));
        this.family = family;
        this.aggregateId = aggregateId;
        this.committedRevision = committedRevision;
        this.report = report;
    }

    public CatalogFamily getFamily() {
        return family;
    }

    public Long getAggregateId() {
        return aggregateId;
    }

    /**
     * Revision that was committed before propagation started, null for a deletion.
     */
    public Integer getCommittedRevision() {
        return committedRevision;
    }

    public PropagationReport getReport() {
        return report;
    }
}
