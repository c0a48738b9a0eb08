package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.NoArgsConstructor;

/**
 * Base record of a point of sale.
 *
 * @author Catalog Team
 */
@Entity
@Table(name = "point_of_sale", indexes = {
    @Index(name = "idx_point_of_sale_owner", columnList = "owner_id")
})
@NoArgsConstructor
public class PointOfSale extends RevisionedBase {

    public PointOfSale(String ownerId) {
        super(ownerId);
    }
}
