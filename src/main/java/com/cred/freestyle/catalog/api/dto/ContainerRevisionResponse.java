package com.cred.freestyle.catalog.api.dto;

import com.cred.freestyle.catalog.domain.model.Container;
import com.cred.freestyle.catalog.domain.model.ContainerRevision;
import com.cred.freestyle.catalog.domain.model.PendingContainerUpdate;
import com.cred.freestyle.catalog.service.DraftView;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a container revision or draft.
 * The public flag is read from the base record, so it is the same for every revision.
 *
 * @author Catalog Team
 */
public class ContainerRevisionResponse {

    private Long id;
    private Integer revision;
    private boolean pending;
    private String name;
    private boolean publicContainer;
    private List<ReferenceResponse> products;
    private Instant createdAt;

    public ContainerRevisionResponse() {
    }

    public static ContainerRevisionResponse fromRevision(ContainerRevision revision, Container container) {
        ContainerRevisionResponse response = new ContainerRevisionResponse();
        response.id = revision.getAggregateId();
        response.revision = revision.getRevision();
        response.pending = false;
        response.name = revision.getName();
        response.publicContainer = container.isPublicContainer();
        response.products = ReferenceResponse.fromReferences(revision.getProductReferences());
        response.createdAt = revision.getCreatedAt();
        return response;
    }

    public static ContainerRevisionResponse fromDraft(DraftView<PendingContainerUpdate> view) {
        PendingContainerUpdate draft = view.getDraft();
        ContainerRevisionResponse response = new ContainerRevisionResponse();
        response.id = draft.getAggregateId();
        response.pending = true;
        response.name = draft.getName();
        response.publicContainer = draft.isPublicContainer();
        response.products = ReferenceResponse.fromProposedChildren(view.getChildren());
        response.createdAt = draft.getUpdatedAt();
        return response;
    }

    // Getters and setters
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

    public boolean isPending() {
        return pending;
    }

    public void setPending(boolean pending) {
        this.pending = pending;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isPublicContainer() {
        return publicContainer;
    }

    public void setPublicContainer(boolean publicContainer) {
        this.publicContainer = publicContainer;
    }

    public List<ReferenceResponse> getProducts() {
        return products;
    }

    public void setProducts(List<ReferenceResponse> products) {
        this.products = products;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
