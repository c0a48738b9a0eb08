package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;

/**
 * Published, immutable revision of a product.
 * Transactions record (productId, revision) so prices and VAT never change retroactively.
 *
 * @author Catalog Team
 */
@Entity
@Immutable
@IdClass(RevisionKey.class)
@Table(name = "product_revision")
@Getter
@Setter
@NoArgsConstructor
public class ProductRevision extends RevisionSnapshot {

    @Id
    @Column(name = "product_id", nullable = false)
    private Long aggregateId;

    @Id
    @Column(name = "revision", nullable = false)
    private Integer revision;

    /**
     * Price including VAT.
     */
    @Column(name = "price_incl_vat", nullable = false, precision = 10, scale = 2)
    private BigDecimal priceInclVat;

    @Column(name = "vat_group_id", nullable = false)
    private Long vatGroupId;

    @Column(name = "category_id", nullable = false)
    private Long categoryId;

    /**
     * Alcohol percentage, 0 for non-alcoholic products.
     */
    @Column(name = "alcohol_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal alcoholPercentage;

    @Column(name = "featured", nullable = false)
    private boolean featured;

    @Column(name = "preferred", nullable = false)
    private boolean preferred;

    /**
     * Whether the product shows on the printed price list.
     */
    @Column(name = "price_list", nullable = false)
    private boolean priceList;
}
