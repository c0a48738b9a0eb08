package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.util.ArrayList;
import java.util.List;

/**
 * Published, immutable revision of a point of sale with the container revisions it offered.
 *
 * @author Catalog Team
 */
@Entity
@Immutable
@IdClass(RevisionKey.class)
@Table(name = "point_of_sale_revision")
@Getter
@Setter
@NoArgsConstructor
public class PointOfSaleRevision extends RevisionSnapshot {

    @Id
    @Column(name = "point_of_sale_id", nullable = false)
    private Long aggregateId;

    @Id
    @Column(name = "revision", nullable = false)
    private Integer revision;

    /**
     * Whether buyers must authenticate before ordering at this point of sale.
     */
    @Column(name = "use_authentication", nullable = false)
    private boolean useAuthentication;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "point_of_sale_revision_containers",
            joinColumns = {
                @JoinColumn(name = "point_of_sale_id", referencedColumnName = "point_of_sale_id"),
                @JoinColumn(name = "revision", referencedColumnName = "revision")
            },
            indexes = @Index(name = "idx_pos_revision_containers_container", columnList = "container_id, container_revision")
    )
    @OrderColumn(name = "slot")
    @AttributeOverrides({
        @AttributeOverride(name = "childId", column = @Column(name = "container_id", nullable = false)),
        @AttributeOverride(name = "childRevision", column = @Column(name = "container_revision", nullable = false))
    })
    private List<ChildReference> containerReferences = new ArrayList<>();

    @Override
    public List<ChildReference> getChildReferences() {
        return containerReferences;
    }
}
