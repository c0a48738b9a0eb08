package com.cred.freestyle.catalog.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Authentication filter that builds the security context from gateway headers.
 *
 * Headers:
 * - X-User-Id: User identifier (required for authenticated requests)
 * - X-User-Role: Role, defaults to USER
 * - X-User-Organizations: Comma-separated organization account ids the user is a member of
 *
 * The gateway validates tokens and forwards the claims; this service trusts the headers.
 * Organization memberships become {@code ORG_<id>} authorities.
 *
 * @author Catalog Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";
    public static final String USER_ORGANIZATIONS_HEADER = "X-User-Organizations";

    static final String ROLE_PREFIX = "ROLE_";
    static final String ORGANIZATION_PREFIX = "ORG_";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);

        if (userId != null && !userId.isBlank()) {
            String role = request.getHeader(USER_ROLE_HEADER);
            if (role == null || role.isBlank()) {
                role = "USER";
            }
            if (!role.startsWith(ROLE_PREFIX)) {
                role = ROLE_PREFIX + role;
            }

            List<SimpleGrantedAuthority> authorities = new ArrayList<>();
            authorities.add(new SimpleGrantedAuthority(role));

            String organizations = request.getHeader(USER_ORGANIZATIONS_HEADER);
            if (organizations != null && !organizations.isBlank()) {
                for (String organizationId : organizations.split(",")) {
                    if (!organizationId.isBlank()) {
                        authorities.add(new SimpleGrantedAuthority(ORGANIZATION_PREFIX + organizationId.trim()));
                    }
                }
            }

            UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(userId, null, authorities);
            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated user: {} with authorities: {}", userId, authorities);
        } else {
            logger.debug("No {} header found, request will be unauthenticated", USER_ID_HEADER);
        }

        filterChain.doFilter(request, response);
    }
}
