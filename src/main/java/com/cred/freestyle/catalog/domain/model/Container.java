package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Base record of a container, a named list of products.
 * The public flag is not revisioned: it applies to every revision of the container.
 *
 * @author Catalog Team
 */
@Entity
@Table(name = "container", indexes = {
    @Index(name = "idx_container_owner", columnList = "owner_id")
})
@Getter
@Setter
@NoArgsConstructor
public class Container extends RevisionedBase {

    @Column(name = "is_public", nullable = false)
    private boolean publicContainer;

    public Container(String ownerId) {
        super(ownerId);
    }

    @Override
    public boolean isPubliclyVisible() {
        return publicContainer;
    }
}
