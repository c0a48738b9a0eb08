package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Draft of the next product revision.
 *
 * @author Catalog Team
 */
@Entity
@Table(name = "pending_product_update")
@Getter
@Setter
@NoArgsConstructor
public class PendingProductUpdate extends PendingRevision {

    @Id
    @Column(name = "product_id", nullable = false)
    private Long aggregateId;

    @Column(name = "price_incl_vat", nullable = false, precision = 10, scale = 2)
    private BigDecimal priceInclVat;

    @Column(name = "vat_group_id", nullable = false)
    private Long vatGroupId;

    @Column(name = "category_id", nullable = false)
    private Long categoryId;

    @Column(name = "alcohol_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal alcoholPercentage;

    @Column(name = "featured", nullable = false)
    private boolean featured;

    @Column(name = "preferred", nullable = false)
    private boolean preferred;

    @Column(name = "price_list", nullable = false)
    private boolean priceList;

    public PendingProductUpdate(Long aggregateId) {
        this.aggregateId = aggregateId;
    }
}
