package com.cred.freestyle.catalog.api.dto;

import com.cred.freestyle.catalog.domain.model.PendingProductUpdate;
import com.cred.freestyle.catalog.domain.model.ProductRevision;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a product revision or a product draft.
 * Drafts have no revision number and are flagged as pending.
 *
 * @author Catalog Team
 */
public class ProductRevisionResponse {

    private Long id;
    private Integer revision;
    private boolean pending;
    private String name;
    private BigDecimal priceInclVat;
    private Long vatGroupId;
    private Long categoryId;
    private BigDecimal alcoholPercentage;
    private boolean featured;
    private boolean preferred;
    private boolean priceList;
    private Instant createdAt;

    public ProductRevisionResponse() {
    }

    public static ProductRevisionResponse fromRevision(ProductRevision revision) {
        ProductRevisionResponse response = new ProductRevisionResponse();
        response.id = revision.getAggregateId();
        response.revision = revision.getRevision();
        response.pending = false;
        response.name = revision.getName();
        response.priceInclVat = revision.getPriceInclVat();
        response.vatGroupId = revision.getVatGroupId();
        response.categoryId = revision.getCategoryId();
        response.alcoholPercentage = revision.getAlcoholPercentage();
        response.featured = revision.isFeatured();
        response.preferred = revision.isPreferred();
        response.priceList = revision.isPriceList();
        response.createdAt = revision.getCreatedAt();
        return response;
    }

    public static ProductRevisionResponse fromDraft(PendingProductUpdate draft) {
        ProductRevisionResponse response = new ProductRevisionResponse();
        response.id = draft.getAggregateId();
        response.pending = true;
        response.name = draft.getName();
        response.priceInclVat = draft.getPriceInclVat();
        response.vatGroupId = draft.getVatGroupId();
        response.categoryId = draft.getCategoryId();
        response.alcoholPercentage = draft.getAlcoholPercentage();
        response.featured = draft.isFeatured();
        response.preferred = draft.isPreferred();
        response.priceList = draft.isPriceList();
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

    public BigDecimal getPriceInclVat() {
        return priceInclVat;
    }

    public void setPriceInclVat(BigDecimal priceInclVat) {
        this.priceInclVat = priceInclVat;
    }

    public Long getVatGroupId() {
        return vatGroupId;
    }

    public void setVatGroupId(Long vatGroupId) {
        this.vatGroupId = vatGroupId;
    }

    public Long getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(Long categoryId) {
        this.categoryId = categoryId;
    }

    public BigDecimal getAlcoholPercentage() {
        return alcoholPercentage;
    }

    public void setAlcoholPercentage(BigDecimal alcoholPercentage) {
        this.alcoholPercentage = alcoholPercentage;
    }

    public boolean isFeatured() {
        return featured;
    }

    public void setFeatured(boolean featured) {
        this.featured = featured;
    }

    public boolean isPreferred() {
        return preferred;
    }

    public void setPreferred(boolean preferred) {
        this.preferred = preferred;
    }

    public boolean isPriceList() {
        return priceList;
    }

    public void setPriceList(boolean priceList) {
        this.priceList = priceList;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
