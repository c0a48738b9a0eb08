package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.PendingRevision;

import java.util.Collections;
import java.util.List;

/**
 * A draft together with the revision each proposed child would be bound to if it were approved now.
 *
 * @param <D> Draft type
 * @author Catalog Team
 */
public class DraftView<D extends PendingRevision> {

    private final D draft;
    private final List<ProposedChild> children;

    public DraftView(D draft, List<ProposedChild> children) {
        this.draft = draft;
        this.children = Collections.unmodifiableList(children);
    }

    public D getDraft() {
        return draft;
    }

    public List<ProposedChild> getChildren() {
        return children;
    }

    /**
     * Proposed child with its current revision at read time, null if it was never published.
     */
    public static class ProposedChild {

        private final Long childId;
        private final Integer currentRevision;

        public ProposedChild(Long childId, Integer currentRevision) {
            this.childId = childId;
            this.currentRevision = currentRevision;
        }

        public Long getChildId() {
            return childId;
        }

        public Integer getCurrentRevision() {
            return currentRevision;
        }
    }
}
