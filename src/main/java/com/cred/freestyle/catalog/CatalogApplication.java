package com.cred.freestyle.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the catalog revision service.
 *
 * System Overview:
 * - Products, containers and points of sale are versioned aggregates with append-only revisions
 * - Edits are staged as drafts and become revisions on approval
 * - A new revision of a child is carried up to every parent that referenced the old one
 * - Historical revisions stay readable forever, so documents pinned to them keep their meaning
 *
 * Architecture:
 * - API Layer: REST controllers with validation and visibility checks
 * - Service Layer: catalog services, revision publisher, propagation engine
 * - Data Access Layer: JPA repositories with row locks on base records
 * - Infrastructure Layer: Redis revision cache, Kafka change events, CloudWatch metrics, repair job
 *
 * @author Catalog Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class CatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogApplication.class, args);
    }
}
