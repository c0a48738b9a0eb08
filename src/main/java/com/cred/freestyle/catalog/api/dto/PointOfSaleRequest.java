package com.cred.freestyle.catalog.api.dto;

import com.cred.freestyle.catalog.domain.model.PointOfSaleFields;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for creating, staging or publishing a point of sale.
 *
 * @author Catalog Team
 */
public class PointOfSaleRequest {

    @Size(max = 64, message = "Owner ID must be at most 64 characters")
    private String ownerId;

    @NotBlank(message = "Name is required")
    @Size(max = 64, message = "Name must be at most 64 characters")
    private String name;

    private boolean useAuthentication;

    @NotNull(message = "Container IDs are required")
    private List<@NotNull Long> containerIds = new ArrayList<>();

    public PointOfSaleRequest() {
    }

    public PointOfSaleFields toFields() {
        return PointOfSaleFields.builder()
                .name(name)
                .useAuthentication(useAuthentication)
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

    public boolean isUseAuthentication() {
        return useAuthentication;
    }

    public void setUseAuthentication(boolean useAuthentication) {
        this.useAuthentication = useAuthentication;
    }

    public List<Long> getContainerIds() {
        return containerIds;
    }

    public void setContainerIds(List<Long> containerIds) {
        this.containerIds = containerIds;
    }
}
