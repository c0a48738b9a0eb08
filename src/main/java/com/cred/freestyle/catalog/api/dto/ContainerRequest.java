package com.cred.freestyle.catalog.api.dto;

import com.cred.freestyle.catalog.domain.model.ContainerFields;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for creating, staging or publishing a container.
 * Products are listed by id; the revision is bound when the container is published.
 *
 * @author Catalog Team
 */
public class ContainerRequest {

    @Size(max = 64, message = "Owner ID must be at most 64 characters")
    private String ownerId;

    @NotBlank(message = "Name is required")
    @Size(max = 64, message = "Name must be at most 64 characters")
    private String name;

    private boolean publicContainer;

    @NotNull(message = "Product IDs are required")
    private List<@NotNull Long> productIds = new ArrayList<>();

    public ContainerRequest() {
    }

    public ContainerRequest(String name, boolean publicContainer, List<Long> productIds) {
        this.name = name;
        this.publicContainer = publicContainer;
        this.productIds = productIds;
    }

    public ContainerFields toFields() {
        return ContainerFields.builder()
                .name(name)
                .publicContainer(publicContainer)
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

    public boolean isPublicContainer() {
        return publicContainer;
    }

    public void setPublicContainer(boolean publicContainer) {
        this.publicContainer = publicContainer;
    }

    public List<Long> getProductIds() {
        return productIds;
    }

    public void setProductIds(List<Long> productIds) {
        this.productIds = productIds;
    }
}
