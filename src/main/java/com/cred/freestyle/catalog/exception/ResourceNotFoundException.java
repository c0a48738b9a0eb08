package com.cred.freestyle.catalog.exception;

/**
 * Exception thrown when an aggregate or one of its revisions does not exist.
 *
 * @author Catalog Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(String.format("%s with ID %s not found", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public ResourceNotFoundException(String resourceType, Long aggregateId, int revision) {
        super(String.format("%s with ID %d has no revision %d", resourceType, aggregateId, revision));
        this.resourceType = resourceType;
        this.resourceId = aggregateId + "@" + revision;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
