package com.cred.freestyle.catalog.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite primary key (aggregate id, revision number) shared by all revision tables.
 *
 * @author Catalog Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RevisionKey implements Serializable {

    private Long aggregateId;
    private Integer revision;
}
