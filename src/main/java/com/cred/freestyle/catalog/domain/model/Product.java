package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.NoArgsConstructor;

/**
 * Base record of a product. Field values live in {@link ProductRevision}.
 *
 * @author Catalog Team
 */
@Entity
@Table(name = "product", indexes = {
    @Index(name = "idx_product_owner", columnList = "owner_id")
})
@NoArgsConstructor
public class Product extends RevisionedBase {

    public Product(String ownerId) {
        super(ownerId);
    }
}
