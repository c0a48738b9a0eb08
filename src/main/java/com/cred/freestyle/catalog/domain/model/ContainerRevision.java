package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.util.ArrayList;
import java.util.List;

/**
 * Published, immutable revision of a container with the product revisions it listed at publish time.
 *
 * @author Catalog Team
 */
@Entity
@Immutable
@IdClass(RevisionKey.class)
@Table(name = "container_revision")
@Getter
@Setter
@NoArgsConstructor
public class ContainerRevision extends RevisionSnapshot {

    @Id
    @Column(name = "container_id", nullable = false)
    private Long aggregateId;

    @Id
    @Column(name = "revision", nullable = false)
    private Integer revision;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "container_revision_products",
            joinColumns = {
                @JoinColumn(name = "container_id", referencedColumnName = "container_id"),
                @JoinColumn(name = "revision", referencedColumnName = "revision")
            },
            indexes = @Index(name = "idx_container_revision_products_product", columnList = "product_id, product_revision")
    )
    @OrderColumn(name = "slot")
    @AttributeOverrides({
        @AttributeOverride(name = "childId", column = @Column(name = "product_id", nullable = false)),
        @AttributeOverride(name = "childRevision", column = @Column(name = "product_revision", nullable = false))
    })
    private List<ChildReference> productReferences = new ArrayList<>();

    @Override
    public List<ChildReference> getChildReferences() {
        return productReferences;
    }
}
