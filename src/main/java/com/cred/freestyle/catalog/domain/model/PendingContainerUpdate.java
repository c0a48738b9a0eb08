package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Draft of the next container revision. Products are listed by id only.
 *
 * @author Catalog Team
 */
@Entity
@Table(name = "pending_container_update")
@Getter
@Setter
@NoArgsConstructor
public class PendingContainerUpdate extends PendingRevision {

    @Id
    @Column(name = "container_id", nullable = false)
    private Long aggregateId;

    @Column(name = "is_public", nullable = false)
    private boolean publicContainer;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pending_container_update_products", joinColumns = @JoinColumn(name = "container_id"))
    @OrderColumn(name = "slot")
    @Column(name = "product_id", nullable = false)
    private List<Long> productIds = new ArrayList<>();

    public PendingContainerUpdate(Long aggregateId) {
        this.aggregateId = aggregateId;
    }

    @Override
    public List<Long> getProposedChildIds() {
        return productIds;
    }
}
