package com.cred.freestyle.catalog.service;

/**
 * Lifecycle of owner accounts as far as the catalog is concerned.
 *
 * @author Catalog Team
 */
public interface OwnerDirectory {

    /**
     * @param ownerId Owner account ID
     * @return true if the owner account has been deactivated
     */
    boolean isDeactivated(String ownerId);

    void deactivate(String ownerId, String deactivatedBy);

    void reactivate(String ownerId);
}
