package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Draft of the next point of sale revision. Containers are listed by id only.
 *
 * @author Catalog Team
 */
@Entity
@Table(name = "pending_point_of_sale_update")
@Getter
@Setter
@NoArgsConstructor
public class PendingPointOfSaleUpdate extends PendingRevision {

    @Id
    @Column(name = "point_of_sale_id", nullable = false)
    private Long aggregateId;

    @Column(name = "use_authentication", nullable = false)
    private boolean useAuthentication;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pending_point_of_sale_update_containers", joinColumns = @JoinColumn(name = "point_of_sale_id"))
    @OrderColumn(name = "slot")
    @Column(name = "container_id", nullable = false)
    private List<Long> containerIds = new ArrayList<>();

    public PendingPointOfSaleUpdate(Long aggregateId) {
        this.aggregateId = aggregateId;
    }

    @Override
    public List<Long> getProposedChildIds() {
        return containerIds;
    }
}
