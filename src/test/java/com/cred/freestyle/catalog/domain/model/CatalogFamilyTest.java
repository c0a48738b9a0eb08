package com.cred.freestyle.catalog.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CatalogFamily Tests")
class CatalogFamilyTest {

    @Test
    @DisplayName("Products propagate to containers, containers to points of sale")
    void parent_FollowsHierarchy() {
        assertThat(CatalogFamily.PRODUCT.parent()).contains(CatalogFamily.CONTAINER);
        assertThat(CatalogFamily.CONTAINER.parent()).contains(CatalogFamily.POINT_OF_SALE);
        assertThat(CatalogFamily.POINT_OF_SALE.parent()).isEmpty();
    }

    @Test
    @DisplayName("child is the inverse of parent")
    void child_IsInverseOfParent() {
        for (CatalogFamily family : CatalogFamily.values()) {
            family.parent().ifPresent(parent -> assertThat(parent.child()).contains(family));
        }
        assertThat(CatalogFamily.PRODUCT.child()).isEmpty();
    }
}
