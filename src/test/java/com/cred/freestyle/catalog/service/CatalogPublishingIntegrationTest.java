package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.*;
import com.cred.freestyle.catalog.exception.ConflictingRevisionException;
import com.cred.freestyle.catalog.exception.InvalidReferenceException;
import com.cred.freestyle.catalog.exception.NoDraftFoundException;
import com.cred.freestyle.catalog.exception.ResourceNotFoundException;
import com.cred.freestyle.catalog.infrastructure.cache.RevisionCacheService;
import com.cred.freestyle.catalog.infrastructure.messaging.CatalogEventPublisher;
import com.cred.freestyle.catalog.infrastructure.metrics.CatalogMetricsService;
import com.cred.freestyle.catalog.infrastructure.scheduler.StaleReferenceRepairScheduler;
import com.cred.freestyle.catalog.service.store.CatalogStores;
import com.cred.freestyle.catalog.service.store.ContainerStore;
import com.cred.freestyle.catalog.service.store.PointOfSaleStore;
import com.cred.freestyle.catalog.service.store.ProductStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.cred.freestyle.catalog.testutil.CatalogTestData.*;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end publishing and propagation against an in-memory database.
 * Runs without a test transaction so every publish and republish commits on its own.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
        ProductStore.class, ContainerStore.class, PointOfSaleStore.class, CatalogStores.class,
        RevisionPublisher.class, PropagationEngine.class, VisibilityResolver.class, JpaOwnerDirectory.class,
        ProductService.class, ContainerService.class, PointOfSaleService.class,
        StaleReferenceRepairScheduler.class
})
@DisplayName("Catalog Publishing Integration Tests")
class CatalogPublishingIntegrationTest {

    private static final String[] TABLES = {
            "container_revision_products", "point_of_sale_revision_containers",
            "pending_container_update_products", "pending_point_of_sale_update_containers",
            "product_revision", "container_revision", "point_of_sale_revision",
            "pending_product_update", "pending_container_update", "pending_point_of_sale_update",
            "product", "container", "point_of_sale", "deactivated_owner"
    };

    @Autowired
    private ProductService productService;

    @Autowired
    private ContainerService containerService;

    @Autowired
    private PointOfSaleService pointOfSaleService;

    @Autowired
    private OwnerDirectory ownerDirectory;

    @Autowired
    private StaleReferenceRepairScheduler repairScheduler;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private RevisionCacheService cacheService;

    @MockBean
    private CatalogEventPublisher eventPublisher;

    @MockBean
    private CatalogMetricsService metricsService;

    @AfterEach
    void tearDown() {
        for (String table : TABLES) {
            jdbcTemplate.execute("DELETE FROM " + table);
        }
    }

    private Long publishedProduct(String name) {
        Long productId = productService.createDraft(OWNER_ID, productFields(name));
        productService.approve(productId);
        return productId;
    }

    private Long publishedContainer(String owner, String name, Long... productIds) {
        Long containerId = containerService.createDraft(owner, containerFields(name), ids(productIds));
        containerService.approve(containerId);
        return containerId;
    }

    private static ContainerFields containerFields(String name) {
        return ContainerFields.builder().name(name).build();
    }

    private static PointOfSaleFields pointOfSaleFields(String name) {
        return PointOfSaleFields.builder().name(name).useAuthentication(true).build();
    }

    private static ProductFields repriced(String name, String price) {
        ProductFields fields = productFields(name);
        fields.setPriceInclVat(new BigDecimal(price));
        return fields;
    }

    // ========================================
    // Propagation
    // ========================================

    @Test
    @DisplayName("Republishing a product moves its container to a new revision and keeps the container's fields")
    void productRepublish_PropagatesToContainer() {
        // Given
        Long productId = publishedProduct("Club Mate");
        Long containerId = publishedContainer(OWNER_ID, "Fridge", productId);
        assertThat(containerService.getCurrent(containerId).getProductReferences()).containsExactly(ref(productId, 1));

        // When
        ProductRevision revision = productService.publishDirect(productId, repriced("Club Mate", "2.80"));

        // Then
        assertThat(revision.getRevision()).isEqualTo(2);
        ContainerRevision current = containerService.getCurrent(containerId);
        assertThat(current.getRevision()).isEqualTo(2);
        assertThat(current.getName()).isEqualTo("Fridge");
        assertThat(current.getProductReferences()).containsExactly(ref(productId, 2));
    }

    @Test
    @DisplayName("Older container revisions keep pointing at the product revision they were published with")
    void productRepublish_HistoryIsStable() {
        // Given
        Long productId = publishedProduct("Club Mate");
        Long containerId = publishedContainer(OWNER_ID, "Fridge", productId);
        List<ChildReference> before = new ArrayList<>(containerService.getRevision(containerId, 1).getProductReferences());

        // When
        productService.publishDirect(productId, repriced("Club Mate", "2.80"));

        // Then
        assertThat(containerService.getRevision(containerId, 1).getProductReferences()).isEqualTo(before);
        assertThat(productService.getRevision(productId, 1).getPriceInclVat()).isEqualByComparingTo("2.50");
    }

    @Test
    @DisplayName("A product change reaches points of sale through their containers")
    void productRepublish_PropagatesThroughPointOfSale() {
        // Given
        Long productId = publishedProduct("Club Mate");
        Long containerId = publishedContainer(OWNER_ID, "Fridge", productId);
        Long otherContainerId = publishedContainer(OWNER_ID, "Shelf");
        Long pointOfSaleId = pointOfSaleService.createDraft(
                OWNER_ID, pointOfSaleFields("Bar"), ids(containerId, otherContainerId));
        pointOfSaleService.approve(pointOfSaleId);

        // When
        productService.publishDirect(productId, repriced("Club Mate", "3.00"));

        // Then
        PointOfSaleRevision current = pointOfSaleService.getCurrent(pointOfSaleId);
        assertThat(current.getRevision()).isEqualTo(2);
        assertThat(current.getName()).isEqualTo("Bar");
        assertThat(current.isUseAuthentication()).isTrue();
        assertThat(current.getContainerReferences()).containsExactly(ref(containerId, 2), ref(otherContainerId, 1));
    }

    @Test
    @DisplayName("A parent whose current revision no longer lists the child is not republished")
    void containerRepublish_StaleParentRevisionIgnored() {
        // Given
        Long containerId = publishedContainer(OWNER_ID, "Fridge");
        Long pointOfSaleId = pointOfSaleService.createDraft(OWNER_ID, pointOfSaleFields("Bar"), ids(containerId));
        pointOfSaleService.approve(pointOfSaleId);
        pointOfSaleService.publishDirect(pointOfSaleId, pointOfSaleFields("Bar"), Collections.emptyList());

        // When
        containerService.publishDirect(containerId, containerFields("Fridge v2"), Collections.emptyList());

        // Then
        assertThat(pointOfSaleService.listRevisions(pointOfSaleId)).hasSize(2);
        assertThat(pointOfSaleService.getCurrent(pointOfSaleId).getContainerReferences()).isEmpty();
    }

    @Test
    @DisplayName("Containers of a deactivated owner are skipped, then caught up by the repair job")
    void deactivatedOwner_SkippedThenRepaired() {
        // Given
        Long productId = publishedProduct("Club Mate");
        Long containerId = publishedContainer("owner-2", "Guest fridge", productId);
        ownerDirectory.deactivate("owner-2", "admin-1");

        // When
        productService.publishDirect(productId, repriced("Club Mate", "2.80"));

        // Then
        assertThat(containerService.getCurrent(containerId).getRevision()).isEqualTo(1);

        // When
        ownerDirectory.reactivate("owner-2");
        int found = repairScheduler.triggerRepairNow();

        // Then
        assertThat(found).isEqualTo(1);
        assertThat(containerService.getCurrent(containerId).getProductReferences()).containsExactly(ref(productId, 2));
    }

    // ========================================
    // Drafts
    // ========================================

    @Test
    @DisplayName("Approving binds products at approval time, not at staging time")
    void approve_BindsChildrenAtApprovalTime() {
        // Given
        Long productId = publishedProduct("Club Mate");
        Long containerId = publishedContainer(OWNER_ID, "Fridge");
        containerService.stageUpdate(containerId, containerFields("Fridge"), ids(productId));
        productService.publishDirect(productId, repriced("Club Mate", "2.80"));

        // When
        ContainerRevision approved = containerService.approve(containerId);

        // Then
        assertThat(approved.getProductReferences()).containsExactly(ref(productId, 2));
    }

    @Test
    @DisplayName("Draft of an unpublished container does not follow child changes and can only be approved once")
    void draft_IsolatedAndSingleUse() {
        // Given
        Long productId = publishedProduct("Club Mate");
        Long containerId = containerService.createDraft(OWNER_ID, containerFields("Fridge"), ids(productId));

        // When
        productService.publishDirect(productId, repriced("Club Mate", "2.80"));

        // Then
        assertThat(containerService.getBase(containerId).isPublished()).isFalse();
        assertThat(containerService.findDraft(containerId)).isPresent();

        containerService.approve(containerId);
        assertThatThrownBy(() -> containerService.approve(containerId)).isInstanceOf(NoDraftFoundException.class);
    }

    @Test
    @DisplayName("A container republished by propagation drops its pending draft")
    void propagation_DropsParentDraft() {
        // Given
        Long productId = publishedProduct("Club Mate");
        Long containerId = publishedContainer(OWNER_ID, "Fridge", productId);
        containerService.stageUpdate(containerId, containerFields("Fridge v2"), ids(productId));

        // When
        productService.publishDirect(productId, repriced("Club Mate", "2.80"));

        // Then
        assertThat(containerService.getCurrent(containerId).getRevision()).isEqualTo(2);
        assertThat(containerService.getCurrent(containerId).getName()).isEqualTo("Fridge");
        assertThat(containerService.findDraft(containerId)).isEmpty();
        assertThatThrownBy(() -> containerService.approve(containerId)).isInstanceOf(NoDraftFoundException.class);
    }

    @Test
    @DisplayName("Deleting a product drops the draft of a container republished without it")
    void softDelete_DropsParentDraftNamingDeletedChild() {
        // Given
        Long productId = publishedProduct("Club Mate");
        Long keptId = publishedProduct("Mate");
        Long containerId = publishedContainer(OWNER_ID, "Fridge", productId, keptId);
        containerService.stageUpdate(containerId, containerFields("Fridge v2"), ids(productId, keptId));

        // When
        productService.softDelete(productId);

        // Then
        assertThat(containerService.getCurrent(containerId).getProductReferences()).containsExactly(ref(keptId, 1));
        assertThat(containerService.findDraft(containerId)).isEmpty();

        containerService.stageUpdate(containerId, containerFields("Fridge v2"), ids(keptId));
        assertThat(containerService.approve(containerId).getRevision()).isEqualTo(3);
    }

    @Test
    @DisplayName("Publishing a container with a never-published product is rejected")
    void publish_UnpublishedChild_Rejected() {
        // Given
        Long draftOnlyProduct = productService.createDraft(OWNER_ID, productFields("Mate"));
        Long containerId = publishedContainer(OWNER_ID, "Fridge");

        // When / Then
        assertThatThrownBy(() -> containerService.publishDirect(containerId, containerFields("Fridge"), ids(draftOnlyProduct)))
                .isInstanceOf(InvalidReferenceException.class);
        assertThat(containerService.getCurrent(containerId).getRevision()).isEqualTo(1);
    }

    // ========================================
    // Deletion
    // ========================================

    @Test
    @DisplayName("Deleting a product removes it from containers and keeps its history readable")
    void softDelete_RemovesFromParents() {
        // Given
        Long productId = publishedProduct("Club Mate");
        Long keptId = publishedProduct("Mate");
        Long containerId = publishedContainer(OWNER_ID, "Fridge", productId, keptId);

        // When
        productService.softDelete(productId);

        // Then
        assertThat(containerService.getCurrent(containerId).getProductReferences()).containsExactly(ref(keptId, 1));
        assertThat(containerService.getRevision(containerId, 1).getProductReferences()).hasSize(2);
        assertThat(productService.getRevision(productId, 1).getName()).isEqualTo("Club Mate");
        assertThatThrownBy(() -> productService.getCurrent(productId)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> productService.softDelete(productId)).isInstanceOf(ResourceNotFoundException.class);
    }

    // ========================================
    // Concurrency
    // ========================================

    @Test
    @DisplayName("Concurrent publishes of one product produce gap-free revision numbers")
    void concurrentPublishes_GapFree() throws Exception {
        // Given
        Long productId = publishedProduct("Club Mate");
        int attempts = 8;
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger committed = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();

        // When
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < attempts; i++) {
            String price = "2." + (10 + i);
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    productService.publishDirect(productId, repriced("Club Mate", price));
                    committed.incrementAndGet();
                } catch (ConflictingRevisionException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(committed.get() + conflicts.get()).isEqualTo(attempts);
        List<Integer> revisions = productService.listRevisions(productId).stream()
                .map(ProductRevision::getRevision)
                .collect(Collectors.toList());
        assertThat(revisions).containsExactlyElementsOf(
                IntStream.rangeClosed(1, 1 + committed.get()).boxed().collect(Collectors.toList()));
        assertThat(productService.getBase(productId).getCurrentRevision()).isEqualTo(1 + committed.get());
    }
}
