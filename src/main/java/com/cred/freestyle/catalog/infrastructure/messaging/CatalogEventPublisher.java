package com.cred.freestyle.catalog.infrastructure.messaging;

import com.cred.freestyle.catalog.infrastructure.messaging.events.CatalogRevisionEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for catalog revision events.
 *
 * Events are keyed by family and aggregate id, so consumers see the revisions of one
 * aggregate in publish order. Sending is best-effort: the database is the source of truth
 * and a failed send is logged, never propagated to the caller.
 *
 * @author Catalog Team
 */
@Service
public class CatalogEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(CatalogEventPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${catalog.kafka.topic:catalog-revisions}")
    private String topic = "catalog-revisions";

    public CatalogEventPublisher(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Publish a revision event.
     *
     * @param event Revision event
     */
    public void publish(CatalogRevisionEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                    topic,
                    event.partitionKey(),
                    payload
            );

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Published {} event for {} {} revision {}, partition: {}",
                            event.getEventType(), event.getFamily(), event.getAggregateId(),
                            event.getRevision(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to publish {} event for {} {} revision {}",
                            event.getEventType(), event.getFamily(), event.getAggregateId(),
                            event.getRevision(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing catalog event for {} {}", event.getFamily(), event.getAggregateId(), e);
        } catch (RuntimeException e) {
            logger.error("Error sending catalog event for {} {}", event.getFamily(), event.getAggregateId(), e);
        }
    }
}
