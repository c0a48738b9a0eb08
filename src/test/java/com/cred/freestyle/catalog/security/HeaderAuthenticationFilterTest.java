package com.cred.freestyle.catalog.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for HeaderAuthenticationFilter and the SecurityUtils helpers reading its result.
 */
@DisplayName("HeaderAuthenticationFilter Unit Tests")
class HeaderAuthenticationFilterTest {

    private final HeaderAuthenticationFilter filter = new HeaderAuthenticationFilter();

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private void authenticate(String userId, String role, String organizations) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/products");
        if (userId != null) {
            request.addHeader(HeaderAuthenticationFilter.USER_ID_HEADER, userId);
        }
        if (role != null) {
            request.addHeader(HeaderAuthenticationFilter.USER_ROLE_HEADER, role);
        }
        if (organizations != null) {
            request.addHeader(HeaderAuthenticationFilter.USER_ORGANIZATIONS_HEADER, organizations);
        }
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());
    }

    @Test
    @DisplayName("doFilter - User id without role defaults to ROLE_USER")
    void doFilter_DefaultsToUserRole() throws Exception {
        // When
        authenticate("user-1", null, null);

        // Then
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication.getPrincipal()).isEqualTo("user-1");
        assertThat(authentication.getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactly("ROLE_USER");
        assertThat(SecurityUtils.isAdmin()).isFalse();
    }

    @Test
    @DisplayName("doFilter - Organizations become ORG_ authorities and actor memberships")
    void doFilter_OrganizationsMapped() throws Exception {
        // When
        authenticate("user-1", "USER", "club-a, club-b,,");

        // Then
        Actor actor = SecurityUtils.currentActor();
        assertThat(actor.getId()).isEqualTo("user-1");
        assertThat(actor.getOrganizationIds()).containsExactlyInAnyOrder("club-a", "club-b");
        assertThat(actor.isMemberOf("club-a")).isTrue();
        assertThat(actor.isAdmin()).isFalse();
    }

    @Test
    @DisplayName("doFilter - ADMIN role is recognised with or without prefix")
    void doFilter_AdminRole() throws Exception {
        // When
        authenticate("admin-1", "ROLE_ADMIN", null);

        // Then
        assertThat(SecurityUtils.isAdmin()).isTrue();
        assertThat(SecurityUtils.currentActor().isAdmin()).isTrue();
    }

    @Test
    @DisplayName("doFilter - Missing user id leaves the request unauthenticated")
    void doFilter_NoHeader_Unauthenticated() throws Exception {
        // When
        authenticate(null, "ADMIN", null);

        // Then
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(SecurityUtils.getCurrentUserId()).isNull();
        assertThat(SecurityUtils.currentActor()).isNull();
    }
}
