package com.cred.freestyle.catalog.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Editable fields of a container. {@code publicContainer} is written to the base record.
 *
 * @author Catalog Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContainerFields {

    private String name;
    private boolean publicContainer;
}
