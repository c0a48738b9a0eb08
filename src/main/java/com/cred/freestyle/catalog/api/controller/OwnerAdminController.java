package com.cred.freestyle.catalog.api.controller;

import com.cred.freestyle.catalog.security.SecurityUtils;
import com.cred.freestyle.catalog.service.OwnerDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin endpoints for owner accounts.
 * Aggregates of a deactivated owner stay readable but no longer follow their children's changes.
 *
 * @author Catalog Team
 */
@RestController
@RequestMapping("/api/v1/admin/owners")
public class OwnerAdminController {

    private static final Logger logger = LoggerFactory.getLogger(OwnerAdminController.class);

    private final OwnerDirectory ownerDirectory;

    public OwnerAdminController(OwnerDirectory ownerDirectory) {
        this.ownerDirectory = ownerDirectory;
    }

    @PostMapping("/{ownerId}/deactivate")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deactivate(@PathVariable String ownerId) {
        SecurityUtils.verifyAdminAccess();
        String adminId = SecurityUtils.getCurrentUserId();

        ownerDirectory.deactivate(ownerId, adminId);
        logger.info("Owner {} deactivated by admin {}", ownerId, adminId);

        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{ownerId}/reactivate")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> reactivate(@PathVariable String ownerId) {
        SecurityUtils.verifyAdminAccess();

        ownerDirectory.reactivate(ownerId);
        logger.info("Owner {} reactivated by admin {}", ownerId, SecurityUtils.getCurrentUserId());

        return ResponseEntity.noContent().build();
    }
}
