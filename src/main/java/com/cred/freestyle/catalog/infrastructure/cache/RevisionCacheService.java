package com.cred.freestyle.catalog.infrastructure.cache;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.domain.model.RevisionSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis cache of published revisions.
 *
 * Revisions are immutable, so entries never need invalidation and only expire to bound memory.
 * Current revision pointers are not cached: they move on every publish and are read from the database.
 *
 * Cache Keys:
 * - revision:{family}:{aggregate_id}:{revision} -> Revision snapshot (JSON)
 *
 * Every Redis failure is logged and treated as a miss.
 *
 * @author Catalog Team
 */
@Service
public class RevisionCacheService {

    private static final Logger logger = LoggerFactory.getLogger(RevisionCacheService.class);

    private static final String REVISION_PREFIX = "revision:";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${catalog.cache.revision-ttl-hours:24}")
    private long revisionTtlHours = 24;

    public RevisionCacheService(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Get a revision from cache.
     *
     * @param family Aggregate family
     * @param aggregateId Aggregate ID
     * @param revision Revision number
     * @param type Revision class
     * @return Optional containing the cached revision
     */
    public <R extends RevisionSnapshot> Optional<R> getRevision(
            CatalogFamily family,
            Long aggregateId,
            int revision,
            Class<R> type
    ) {
        String key = revisionKey(family, aggregateId, revision);
        try {
            String value = redisTemplate.opsForValue().get(key);
            if (value != null) {
                logger.debug("Cache hit for revision: {}", key);
                return Optional.of(objectMapper.readValue(value, type));
            }
            logger.debug("Cache miss for revision: {}", key);
            return Optional.empty();
        } catch (Exception e) {
            logger.error("Error getting revision from cache: {}", key, e);
            return Optional.empty();
        }
    }

    /**
     * Cache a published revision.
     *
     * @param family Aggregate family
     * @param revision Published revision
     */
    public void cacheRevision(CatalogFamily family, RevisionSnapshot revision) {
        String key = revisionKey(family, revision.getAggregateId(), revision.getRevision());
        try {
            String value = objectMapper.writeValueAsString(revision);
            redisTemplate.opsForValue().set(key, value, Duration.ofHours(revisionTtlHours));
            logger.debug("Cached revision: {}", key);
        } catch (Exception e) {
            logger.error("Error caching revision: {}", key, e);
        }
    }

    static String revisionKey(CatalogFamily family, Long aggregateId, int revision) {
        return REVISION_PREFIX + family.name().toLowerCase() + ":" + aggregateId + ":" + revision;
    }
}
