package com.cred.freestyle.catalog.api.dto;

import com.cred.freestyle.catalog.domain.model.ProductFields;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request DTO for creating, staging or publishing a product.
 * {@code ownerId} is only read on create and defaults to the caller.
 *
 * @author Catalog Team
 */
public class ProductRequest {

    @Size(max = 64, message = "Owner ID must be at most 64 characters")
    private String ownerId;

    @NotBlank(message = "Name is required")
    @Size(max = 64, message = "Name must be at most 64 characters")
    private String name;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.00", message = "Price cannot be negative")
    private BigDecimal priceInclVat;

    @NotNull(message = "VAT group is required")
    private Long vatGroupId;

    @NotNull(message = "Category is required")
    private Long categoryId;

    @DecimalMin(value = "0.00", message = "Alcohol percentage cannot be negative")
    @DecimalMax(value = "100.00", message = "Alcohol percentage cannot exceed 100")
    private BigDecimal alcoholPercentage;

    private boolean featured;

    private boolean preferred;

    private boolean priceList;

    public ProductRequest() {
    }

    public ProductFields toFields() {
        return ProductFields.builder()
                .name(name)
                .priceInclVat(priceInclVat)
                .vatGroupId(vatGroupId)
                .categoryId(categoryId)
                .alcoholPercentage(alcoholPercentage != null ? alcoholPercentage : BigDecimal.ZERO)
                .featured(featured)
                .preferred(preferred)
                .priceList(priceList)
                .build();
    }

    // Getters and setters
    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
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
}
