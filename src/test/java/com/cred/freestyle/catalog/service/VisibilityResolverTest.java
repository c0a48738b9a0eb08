package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.Container;
import com.cred.freestyle.catalog.domain.model.Product;
import com.cred.freestyle.catalog.security.Actor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;

import java.time.Instant;
import java.util.Set;

import static com.cred.freestyle.catalog.testutil.CatalogTestData.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for VisibilityResolver.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("VisibilityResolver Unit Tests")
class VisibilityResolverTest {

    @Mock
    private OwnerDirectory ownerDirectory;

    private VisibilityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new VisibilityResolver(ownerDirectory);
    }

    // ========================================
    // resolve() Tests
    // ========================================

    @Test
    @DisplayName("resolve - Owner sees OWNED even for a public container")
    void resolve_OwnerWinsOverPublic() {
        // Given
        Container container = container(20L, 1);
        container.setPublicContainer(true);

        // When / Then
        assertThat(resolver.resolve(Actor.user(OWNER_ID), container)).isEqualTo(Visibility.OWNED);
    }

    @Test
    @DisplayName("resolve - Public container wins over organization membership")
    void resolve_PublicWinsOverOrganization() {
        // Given
        Container container = container(20L, 1);
        container.setPublicContainer(true);
        Actor member = new Actor("user-2", Set.of(OWNER_ID), false);

        // When / Then
        assertThat(resolver.resolve(member, container)).isEqualTo(Visibility.PUBLIC);
        assertThat(resolver.resolve(null, container)).isEqualTo(Visibility.PUBLIC);
    }

    @Test
    @DisplayName("resolve - Organization member sees ORGANIZATIONAL")
    void resolve_OrganizationMember() {
        // Given
        Product product = product(1L, 1);
        Actor member = new Actor("user-2", Set.of(OWNER_ID), false);

        // When / Then
        assertThat(resolver.resolve(member, product)).isEqualTo(Visibility.ORGANIZATIONAL);
    }

    @Test
    @DisplayName("resolve - Stranger and anonymous caller see nothing")
    void resolve_StrangerSeesNothing() {
        // Given
        Product product = product(1L, 1);

        // When / Then
        assertThat(resolver.resolve(Actor.user("user-9"), product)).isEqualTo(Visibility.NONE);
        assertThat(resolver.resolve(null, product)).isEqualTo(Visibility.NONE);
    }

    // ========================================
    // verifyVisible() Tests
    // ========================================

    @Test
    @DisplayName("verifyVisible - Admin passes for anything")
    void verifyVisible_Admin() {
        // Given
        Actor admin = new Actor("admin-1", Set.of(), true);

        // When / Then
        assertThatCode(() -> resolver.verifyVisible(admin, product(1L, 1))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("verifyVisible - Stranger is denied")
    void verifyVisible_Stranger_Denied() {
        assertThatThrownBy(() -> resolver.verifyVisible(Actor.user("user-9"), product(1L, 1)))
                .isInstanceOf(AccessDeniedException.class);
    }

    // ========================================
    // isPropagationTarget() Tests
    // ========================================

    @Test
    @DisplayName("isPropagationTarget - Live aggregate of an active owner is a target")
    void isPropagationTarget_ActiveOwner() {
        // Given
        when(ownerDirectory.isDeactivated(OWNER_ID)).thenReturn(false);

        // When / Then
        assertThat(resolver.isPropagationTarget(container(20L, 1))).isTrue();
    }

    @Test
    @DisplayName("isPropagationTarget - Deactivated owner is not a target")
    void isPropagationTarget_DeactivatedOwner() {
        // Given
        when(ownerDirectory.isDeactivated(OWNER_ID)).thenReturn(true);

        // When / Then
        assertThat(resolver.isPropagationTarget(container(20L, 1))).isFalse();
    }

    @Test
    @DisplayName("isPropagationTarget - Deleted aggregate is not a target")
    void isPropagationTarget_Deleted() {
        // Given
        Container container = container(20L, 1);
        container.setDeletedAt(Instant.now());

        // When / Then
        assertThat(resolver.isPropagationTarget(container)).isFalse();
        verifyNoInteractions(ownerDirectory);
    }
}
