package com.cred.freestyle.catalog.infrastructure.messaging.events;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;

import java.time.Instant;

/**
 * Event describing a change of the current revision of a catalog aggregate.
 * Published to Kafka after the change is committed.
 *
 * Event Types:
 * - PUBLISHED: A new revision became current
 * - DELETED: The aggregate was soft-deleted
 *
 * @author Catalog Team
 */
public class CatalogRevisionEvent {

    private CatalogFamily family;
    private Long aggregateId;
    private Integer revision;
    private Integer previousRevision;
    private EventType eventType;
    private Cause cause;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public CatalogRevisionEvent() {
    }

    public CatalogRevisionEvent(
            CatalogFamily family,
            Long aggregateId,
            Integer revision,
            Integer previousRevision,
            EventType eventType,
            Cause cause
    ) {
        this.family = family;
        this.aggregateId = aggregateId;
        this.revision = revision;
        this.previousRevision = previousRevision;
        this.eventType = eventType;
        this.cause = cause;
        this.timestamp = Instant.now();
    }

    public static CatalogRevisionEvent published(
            CatalogFamily family,
            Long aggregateId,
            Integer revision,
            Integer previousRevision,
            Cause cause
    ) {
        return new CatalogRevisionEvent(family, aggregateId, revision, previousRevision, EventType.PUBLISHED, cause);
    }

    public static CatalogRevisionEvent deleted(CatalogFamily family, Long aggregateId, Integer lastRevision) {
        return new CatalogRevisionEvent(family, aggregateId, lastRevision, lastRevision, EventType.DELETED, Cause.DELETION);
    }

    /**
     * Partition key. Keeps all events of one aggregate in order.
     */
    public String partitionKey() {
        return family.name() + ":" + aggregateId;
    }

    // Getters and setters
    public CatalogFamily getFamily() {
        return family;
    }

    public void setFamily(CatalogFamily family) {
        this.family = family;
    }

    public Long getAggregateId() {
        return aggregateId;
    }

    public void setAggregateId(Long aggregateId) {
        this.aggregateId = aggregateId;
    }

    public Integer getRevision() {
        return revision;
    }

    public void setRevision(Integer revision) {
        this.revision = revision;
    }

    public Integer getPreviousRevision() {
        return previousRevision;
    }

    public void setPreviousRevision(Integer previousRevision) {
        this.previousRevision = previousRevision;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public Cause getCause() {
        return cause;
    }

    public void setCause(Cause cause) {
        this.cause = cause;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public enum EventType {
        PUBLISHED,
        DELETED
    }

    /**
     * What triggered the change.
     */
    public enum Cause {
        DIRECT,
        APPROVAL,
        PROPAGATION,
        DELETION
    }

    @Override
    public String toString() {
        return "CatalogRevisionEvent{" +
                "family=" + family +
                ", aggregateId=" + aggregateId +
                ", revision=" + revision +
                ", previousRevision=" + previousRevision +
                ", eventType=" + eventType +
                ", cause=" + cause +
                ", timestamp=" + timestamp +
                '}';
    }
}
