package com.cred.freestyle.catalog.api.dto;

import com.cred.freestyle.catalog.domain.model.PendingPointOfSaleUpdate;
import com.cred.freestyle.catalog.domain.model.PointOfSaleRevision;
import com.cred.freestyle.catalog.service.DraftView;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a point-of-sale revision or draft.
 *
 * @author Catalog Team
 */
public class PointOfSaleRevisionResponse {

    private Long id;
    private Integer revision;
    private boolean pending;
    private String name;
    private boolean useAuthentication;
    private List<ReferenceResponse> containers;
    private Instant createdAt;

    public PointOfSaleRevisionResponse() {
    }

    public static PointOfSaleRevisionResponse fromRevision(PointOfSaleRevision revision) {
        PointOfSaleRevisionResponse response = new PointOfSaleRevisionResponse();
        response.id = revision.getAggregateId();
        response.revision = revision.getRevision();
        response.pending = false;
        response.name = revision.getName();
        response.useAuthentication = revision.isUseAuthentication();
        response.containers = ReferenceResponse.fromReferences(revision.getContainerReferences());
        response.createdAt = revision.getCreatedAt();
        return response;
    }

    public static PointOfSaleRevisionResponse fromDraft(DraftView<PendingPointOfSaleUpdate> view) {
        PendingPointOfSaleUpdate draft = view.getDraft();
        PointOfSaleRevisionResponse response = new PointOfSaleRevisionResponse();
        response.id = draft.getAggregateId();
        response.pending = true;
        response.name = draft.getName();
        response.useAuthentication = draft.isUseAuthentication();
        response.containers = ReferenceResponse.fromProposedChildren(view.getChildren());
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

    public boolean isUseAuthentication() {
        return useAuthentication;
    }

    public void setUseAuthentication(boolean useAuthentication) {
        this.useAuthentication = useAuthentication;
    }

    public List<ReferenceResponse> getContainers() {
        return containers;
    }

    public void setContainers(List<ReferenceResponse> containers) {
        this.containers = containers;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
