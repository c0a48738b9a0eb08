package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.domain.model.ContainerRevision;
import com.cred.freestyle.catalog.domain.model.PointOfSaleRevision;
import com.cred.freestyle.catalog.exception.ConflictingRevisionException;
import com.cred.freestyle.catalog.infrastructure.cache.RevisionCacheService;
import com.cred.freestyle.catalog.infrastructure.messaging.CatalogEventPublisher;
import com.cred.freestyle.catalog.infrastructure.messaging.events.CatalogRevisionEvent;
import com.cred.freestyle.catalog.infrastructure.metrics.CatalogMetricsService;
import com.cred.freestyle.catalog.service.store.CatalogStores;
import com.cred.freestyle.catalog.service.store.ContainerStore;
import com.cred.freestyle.catalog.service.store.PointOfSaleStore;
import com.cred.freestyle.catalog.service.store.ProductStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.cred.freestyle.catalog.testutil.CatalogTestData.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PropagationEngine.
 * Tests multi-level propagation and how failed parents are reported.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PropagationEngine Unit Tests")
class PropagationEngineTest {

    @Mock
    private CatalogStores stores;

    @Mock
    private ProductStore productStore;

    @Mock
    private ContainerStore containerStore;

    @Mock
    private PointOfSaleStore pointOfSaleStore;

    @Mock
    private RevisionPublisher publisher;

    @Mock
    private RevisionCacheService cacheService;

    @Mock
    private CatalogEventPublisher eventPublisher;

    @Mock
    private CatalogMetricsService metricsService;

    private PropagationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PropagationEngine(stores, publisher, cacheService, eventPublisher, metricsService);
        lenient().doReturn(productStore).when(stores).forFamily(CatalogFamily.PRODUCT);
        lenient().doReturn(containerStore).when(stores).forFamily(CatalogFamily.CONTAINER);
        lenient().doReturn(pointOfSaleStore).when(stores).forFamily(CatalogFamily.POINT_OF_SALE);
    }

    private static Optional<PublishedRevision<?>> containerPublished(long id, int revision, int previous) {
        return Optional.of(new PublishedRevision<>(CatalogFamily.CONTAINER,
                containerRevision(id, revision, "Container " + id), previous));
    }

    private static Optional<PublishedRevision<?>> pointOfSalePublished(long id, int revision, int previous) {
        return Optional.of(new PublishedRevision<>(CatalogFamily.POINT_OF_SALE,
                pointOfSaleRevision(id, revision, "Bar " + id), previous));
    }

    // ========================================
    // propagate() Tests
    // ========================================

    @Test
    @DisplayName("propagate - Product change reaches containers and then points of sale")
    void propagate_CascadesThroughAllLevels() {
        // Given
        when(productStore.findBase(1L)).thenReturn(Optional.of(product(1L, 3)));
        when(containerStore.findCurrentReferencing(1L, 2))
                .thenReturn(List.of(containerRevision(20L, 4, "Fridge", ref(1L, 2))));
        when(publisher.republishWithSubstitution(CatalogFamily.CONTAINER, 20L, 1L, 2, 3))
                .thenReturn(containerPublished(20L, 5, 4));

        when(containerStore.findBase(20L)).thenReturn(Optional.of(container(20L, 5)));
        when(pointOfSaleStore.findCurrentReferencing(20L, 4))
                .thenReturn(List.of(pointOfSaleRevision(30L, 1, "Bar", ref(20L, 4))));
        when(publisher.republishWithSubstitution(CatalogFamily.POINT_OF_SALE, 30L, 20L, 4, 5))
                .thenReturn(pointOfSalePublished(30L, 2, 1));

        // When
        PropagationReport report = engine.propagate(CatalogFamily.PRODUCT, 1L, 2);

        // Then
        assertThat(report.hasFailures()).isFalse();
        assertThat(report.getRepublished())
                .extracting(PropagationReport.Entry::getFamily, PropagationReport.Entry::getAggregateId,
                        PropagationReport.Entry::getRevision)
                .containsExactly(
                        tuple(CatalogFamily.CONTAINER, 20L, 5),
                        tuple(CatalogFamily.POINT_OF_SALE, 30L, 2));

        verify(cacheService, times(2)).cacheRevision(any(), any());
        verify(metricsService).recordPropagation(eq(CatalogFamily.PRODUCT), eq(2), eq(0), anyLong());
    }

    @Test
    @DisplayName("propagate - Republished parents emit PROPAGATION events")
    void propagate_PublishesPropagationEvents() {
        // Given
        when(productStore.findBase(1L)).thenReturn(Optional.of(product(1L, 2)));
        when(containerStore.findCurrentReferencing(1L, 1))
                .thenReturn(List.of(containerRevision(20L, 1, "Fridge", ref(1L, 1))));
        when(publisher.republishWithSubstitution(CatalogFamily.CONTAINER, 20L, 1L, 1, 2))
                .thenReturn(containerPublished(20L, 2, 1));
        when(containerStore.findBase(20L)).thenReturn(Optional.of(container(20L, 2)));
        when(pointOfSaleStore.findCurrentReferencing(20L, 1)).thenReturn(Collections.emptyList());

        // When
        engine.propagate(CatalogFamily.PRODUCT, 1L, 1);

        // Then
        ArgumentCaptor<CatalogRevisionEvent> captor = ArgumentCaptor.forClass(CatalogRevisionEvent.class);
        verify(eventPublisher).publish(captor.capture());
        CatalogRevisionEvent event = captor.getValue();
        assertThat(event.getFamily()).isEqualTo(CatalogFamily.CONTAINER);
        assertThat(event.getAggregateId()).isEqualTo(20L);
        assertThat(event.getRevision()).isEqualTo(2);
        assertThat(event.getPreviousRevision()).isEqualTo(1);
        assertThat(event.getCause()).isEqualTo(CatalogRevisionEvent.Cause.PROPAGATION);
        verify(metricsService).recordRevisionPublished(CatalogFamily.CONTAINER, CatalogRevisionEvent.Cause.PROPAGATION);
    }

    @Test
    @DisplayName("propagate - A parent listing the child twice is republished once")
    void propagate_DeduplicatesParents() {
        // Given
        when(productStore.findBase(1L)).thenReturn(Optional.of(product(1L, 3)));
        ContainerRevision parent = containerRevision(20L, 4, "Fridge", ref(1L, 2), ref(1L, 2));
        when(containerStore.findCurrentReferencing(1L, 2)).thenReturn(List.of(parent, parent));
        when(publisher.republishWithSubstitution(CatalogFamily.CONTAINER, 20L, 1L, 2, 3))
                .thenReturn(containerPublished(20L, 5, 4));
        when(containerStore.findBase(20L)).thenReturn(Optional.of(container(20L, 5)));
        when(pointOfSaleStore.findCurrentReferencing(20L, 4)).thenReturn(Collections.emptyList());

        // When
        PropagationReport report = engine.propagate(CatalogFamily.PRODUCT, 1L, 2);

        // Then
        assertThat(report.getRepublished()).hasSize(1);
        verify(publisher, times(1)).republishWithSubstitution(CatalogFamily.CONTAINER, 20L, 1L, 2, 3);
    }

    @Test
    @DisplayName("propagate - Skipped parent is reported and does not cascade")
    void propagate_SkippedParent_Reported() {
        // Given
        when(productStore.findBase(1L)).thenReturn(Optional.of(product(1L, 3)));
        when(containerStore.findCurrentReferencing(1L, 2))
                .thenReturn(List.of(containerRevision(21L, 1, "Shelf", ref(1L, 2))));
        when(publisher.republishWithSubstitution(CatalogFamily.CONTAINER, 21L, 1L, 2, 3))
                .thenReturn(Optional.empty());

        // When
        PropagationReport report = engine.propagate(CatalogFamily.PRODUCT, 1L, 2);

        // Then
        assertThat(report.getRepublished()).isEmpty();
        assertThat(report.getSkipped()).singleElement()
                .extracting(PropagationReport.Entry::getAggregateId)
                .isEqualTo(21L);
        verifyNoInteractions(pointOfSaleStore, eventPublisher);
    }

    @Test
    @DisplayName("propagate - One failing parent does not stop the others")
    void propagate_FailureIsBestEffort() {
        // Given
        when(productStore.findBase(1L)).thenReturn(Optional.of(product(1L, 3)));
        when(containerStore.findCurrentReferencing(1L, 2)).thenReturn(List.of(
                containerRevision(20L, 4, "Fridge", ref(1L, 2)),
                containerRevision(21L, 1, "Shelf", ref(1L, 2))));
        when(publisher.republishWithSubstitution(CatalogFamily.CONTAINER, 20L, 1L, 2, 3))
                .thenThrow(new ConflictingRevisionException(CatalogFamily.CONTAINER, 20L, null));
        when(publisher.republishWithSubstitution(CatalogFamily.CONTAINER, 21L, 1L, 2, 3))
                .thenReturn(containerPublished(21L, 2, 1));
        when(containerStore.findBase(21L)).thenReturn(Optional.of(container(21L, 2)));
        when(pointOfSaleStore.findCurrentReferencing(21L, 1)).thenReturn(Collections.emptyList());

        // When
        PropagationReport report = engine.propagate(CatalogFamily.PRODUCT, 1L, 2);

        // Then
        assertThat(report.hasFailures()).isTrue();
        assertThat(report.getFailures()).extracting(PropagationReport.Entry::getAggregateId).containsExactly(20L);
        assertThat(report.getRepublished()).extracting(PropagationReport.Entry::getAggregateId).containsExactly(21L);
        verify(metricsService).recordError(eq("PROPAGATION_ERROR"), anyString());
    }

    @Test
    @DisplayName("propagate - First revision has nothing to propagate")
    void propagate_NoPreviousRevision_NoOp() {
        // When
        PropagationReport report = engine.propagate(CatalogFamily.PRODUCT, 1L, 0);

        // Then
        assertThat(report.getRepublished()).isEmpty();
        verifyNoInteractions(stores, publisher);
    }

    @Test
    @DisplayName("propagate - Child that has not moved past the previous revision is ignored")
    void propagate_ChildNotAdvanced_NoOp() {
        // Given
        when(productStore.findBase(1L)).thenReturn(Optional.of(product(1L, 2)));

        // When
        PropagationReport report = engine.propagate(CatalogFamily.PRODUCT, 1L, 2);

        // Then
        assertThat(report.getRepublished()).isEmpty();
        verifyNoInteractions(publisher);
    }

    @Test
    @DisplayName("propagate - Point of sale changes have no parents")
    void propagate_TopLevel_NoOp() {
        // When
        PropagationReport report = engine.propagate(CatalogFamily.POINT_OF_SALE, 30L, 1);

        // Then
        assertThat(report.getRepublished()).isEmpty();
        verifyNoInteractions(publisher);
    }

    // ========================================
    // propagateDeletion() Tests
    // ========================================

    @Test
    @DisplayName("propagateDeletion - Removes the deleted product and cascades the container change")
    void propagateDeletion_RemovesAndCascades() {
        // Given
        when(containerStore.findCurrentReferencingChild(1L))
                .thenReturn(List.of(containerRevision(20L, 4, "Fridge", ref(1L, 2))));
        when(publisher.republishWithout(CatalogFamily.CONTAINER, 20L, 1L))
                .thenReturn(containerPublished(20L, 5, 4));
        when(containerStore.findBase(20L)).thenReturn(Optional.of(container(20L, 5)));
        PointOfSaleRevision bar = pointOfSaleRevision(30L, 3, "Bar", ref(20L, 4));
        when(pointOfSaleStore.findCurrentReferencing(20L, 4)).thenReturn(List.of(bar));
        when(publisher.republishWithSubstitution(CatalogFamily.POINT_OF_SALE, 30L, 20L, 4, 5))
                .thenReturn(pointOfSalePublished(30L, 4, 3));

        // When
        PropagationReport report = engine.propagateDeletion(CatalogFamily.PRODUCT, 1L);

        // Then
        assertThat(report.getRepublished())
                .extracting(PropagationReport.Entry::getAggregateId)
                .containsExactly(20L, 30L);
    }

    @Test
    @DisplayName("propagateDeletion - Deleting a point of sale touches nothing")
    void propagateDeletion_TopLevel_NoOp() {
        // When
        PropagationReport report = engine.propagateDeletion(CatalogFamily.POINT_OF_SALE, 30L);

        // Then
        assertThat(report.getRepublished()).isEmpty();
        verifyNoInteractions(stores, publisher, metricsService);
    }

    @Test
    @DisplayName("propagateDeletion - Failure is recorded in the report")
    void propagateDeletion_Failure_Recorded() {
        // Given
        when(containerStore.findCurrentReferencingChild(1L))
                .thenReturn(List.of(containerRevision(20L, 4, "Fridge", ref(1L, 2))));
        when(publisher.republishWithout(CatalogFamily.CONTAINER, 20L, 1L))
                .thenThrow(new IllegalStateException("Cannot advance from revision 4 to 6"));

        // When
        PropagationReport report = engine.propagateDeletion(CatalogFamily.PRODUCT, 1L);

        // Then
        assertThat(report.getFailures()).singleElement()
                .extracting(PropagationReport.Entry::getMessage)
                .isEqualTo("Cannot advance from revision 4 to 6");
    }
}
