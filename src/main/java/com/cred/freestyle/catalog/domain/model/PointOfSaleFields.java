package com.cred.freestyle.catalog.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Editable fields of a point of sale.
 *
 * @author Catalog Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointOfSaleFields {

    private String name;
    private boolean useAuthentication;
}
