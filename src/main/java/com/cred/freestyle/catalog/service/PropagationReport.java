package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one propagation pass over all parent levels.
 *
 * @author Catalog Team
 */
public class PropagationReport {

    private final CatalogFamily sourceFamily;
    private final Long sourceId;
    private final List<Entry> republished = new ArrayList<>();
    private final List<Entry> skipped = new ArrayList<>();
    private final List<Entry> failures = new ArrayList<>();

    public PropagationReport(CatalogFamily sourceFamily, Long sourceId) {
        this.sourceFamily = sourceFamily;
        this.sourceId = sourceId;
    }

    public void recordRepublished(CatalogFamily family, Long aggregateId, Integer revision) {
        republished.add(new Entry(family, aggregateId, revision, null));
    }

    public void recordSkipped(CatalogFamily family, Long aggregateId, String reason) {
        skipped.add(new Entry(family, aggregateId, null, reason));
    }

    public void recordFailure(CatalogFamily family, Long aggregateId, Exception cause) {
        failures.add(new Entry(family, aggregateId, null, cause.getMessage()));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public CatalogFamily getSourceFamily() {
        return sourceFamily;
    }

    public Long getSourceId() {
        return sourceId;
    }

    public List<Entry> getRepublished() {
        return Collections.unmodifiableList(republished);
    }

    public List<Entry> getSkipped() {
        return Collections.unmodifiableList(skipped);
    }

    public List<Entry> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    @Override
    public String toString() {
        return String.format("PropagationReport{source=%s %d, republished=%d, skipped=%d, failed=%d}",
                sourceFamily, sourceId, republished.size(), skipped.size(), failures.size());
    }

    /**
     * One parent touched by the pass.
     */
    public static class Entry {

        private final CatalogFamily family;
        private final Long aggregateId;
        private final Integer revision;
        private final String message;

        public Entry(CatalogFamily family, Long aggregateId, Integer revision, String message) {
            this.family = family;
            this.aggregateId = aggregateId;
            this.revision = revision;
            this.message = message;
        }

        public CatalogFamily getFamily() {
            return family;
        }

        public Long getAggregateId() {
            return aggregateId;
        }

        /**
         * New revision for republished parents, null otherwise.
         */
        public Integer getRevision() {
            return revision;
        }

        /**
         * Skip reason or failure message.
         */
        public String getMessage() {
            return message;
        }
    }
}
