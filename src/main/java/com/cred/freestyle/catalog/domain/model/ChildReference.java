package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pointer from a parent revision to one exact revision of a child aggregate.
 * Bound at publish time and never changed afterwards.
 *
 * @author Catalog Team
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChildReference {

    @Column(name = "child_id", nullable = false)
    private Long childId;

    @Column(name = "child_revision", nullable = false)
    private Integer childRevision;

    public boolean refersTo(Long aggregateId) {
        return childId.equals(aggregateId);
    }
}
