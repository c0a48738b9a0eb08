package com.cred.freestyle.catalog.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Owner account that has been closed. Aggregates of deactivated owners stay readable
 * but are no longer republished by propagation.
 *
 * @author Catalog Team
 */
@Entity
@Table(name = "deactivated_owner")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeactivatedOwner {

    @Id
    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Column(name = "deactivated_by", length = 64)
    private String deactivatedBy;

    @Column(name = "deactivated_at", nullable = false)
    private Instant deactivatedAt;

    @PrePersist
    protected void onCreate() {
        if (deactivatedAt == null) {
            deactivatedAt = Instant.now();
        }
    }
}
