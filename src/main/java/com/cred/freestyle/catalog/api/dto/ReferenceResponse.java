package com.cred.freestyle.catalog.api.dto;

import com.cred.freestyle.catalog.domain.model.ChildReference;
import com.cred.freestyle.catalog.service.DraftView;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A child aggregate pinned to one revision.
 * For drafts the revision is the child's current one at read time, null if it was never published.
 *
 * @author Catalog Team
 */
public class ReferenceResponse {

    private Long id;
    private Integer revision;

    public ReferenceResponse() {
    }

    public ReferenceResponse(Long id, Integer revision) {
        this.id = id;
        this.revision = revision;
    }

    public static List<ReferenceResponse> fromReferences(List<ChildReference> references) {
        return references.stream()
                .map(reference -> new ReferenceResponse(reference.getChildId(), reference.getChildRevision()))
                .collect(Collectors.toList());
    }

    public static List<ReferenceResponse> fromProposedChildren(List<DraftView.ProposedChild> children) {
        return children.stream()
                .map(child -> new ReferenceResponse(child.getChildId(), child.getCurrentRevision()))
                .collect(Collectors.toList());
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Integer getRevision() {
        return revision;
    }

    public void setRevision(Integer revision) {
        this.revision = revision;
    }
}
