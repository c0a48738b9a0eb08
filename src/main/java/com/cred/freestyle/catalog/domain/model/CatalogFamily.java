package com.cred.freestyle.catalog.domain.model;

import java.util.Optional;

/**
 * The three revisioned aggregate families of the catalog.
 * References are strictly layered: a Container lists Products and a Point of Sale lists Containers.
 *
 * @author Catalog Team
 */
public enum CatalogFamily {

    PRODUCT("Product"),
    CONTAINER("Container"),
    POINT_OF_SALE("PointOfSale");

    private final String displayName;

    CatalogFamily(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Family whose revisions reference aggregates of this family.
     *
     * @return Parent family, empty for points of sale
     */
    public Optional<CatalogFamily> parent() {
        switch (this) {
            case PRODUCT:
                return Optional.of(CONTAINER);
            case CONTAINER:
                return Optional.of(POINT_OF_SALE);
            default:
                return Optional.empty();
        }
    }

    /**
     * Family referenced by revisions of this family.
     *
     * @return Child family, empty for products
     */
    public Optional<CatalogFamily> child() {
        switch (this) {
            case CONTAINER:
                return Optional.of(PRODUCT);
            case POINT_OF_SALE:
                return Optional.of(CONTAINER);
            default:
                return Optional.empty();
        }
    }
}
