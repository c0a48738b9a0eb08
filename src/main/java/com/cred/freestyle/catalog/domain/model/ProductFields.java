package com.cred.freestyle.catalog.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Editable fields of a product revision.
 *
 * @author Catalog Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductFields {

    private String name;
    private BigDecimal priceInclVat;
    private Long vatGroupId;
    private Long categoryId;
    private BigDecimal alcoholPercentage;
    private boolean featured;
    private boolean preferred;
    private boolean priceList;
}
