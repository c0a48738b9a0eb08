package com.cred.freestyle.catalog.api.controller;

import com.cred.freestyle.catalog.api.dto.ContainerRequest;
import com.cred.freestyle.catalog.api.dto.ContainerRevisionResponse;
import com.cred.freestyle.catalog.api.dto.CreatedResponse;
import com.cred.freestyle.catalog.domain.model.Container;
import com.cred.freestyle.catalog.domain.model.ContainerRevision;
import com.cred.freestyle.catalog.exception.NoDraftFoundException;
import com.cred.freestyle.catalog.security.Actor;
import com.cred.freestyle.catalog.security.SecurityUtils;
import com.cred.freestyle.catalog.service.ContainerService;
import com.cred.freestyle.catalog.service.VisibilityResolver;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

/**
 * REST controller for containers.
 * Public containers are readable by anyone, including anonymous callers.
 *
 * @author Catalog Team
 */
@RestController
@RequestMapping("/api/v1/containers")
public class ContainerController {

    private static final Logger logger = LoggerFactory.getLogger(ContainerController.class);

    private final ContainerService containerService;
    private final VisibilityResolver visibilityResolver;

    public ContainerController(ContainerService containerService, VisibilityResolver visibilityResolver) {
        this.containerService = containerService;
        this.visibilityResolver = visibilityResolver;
    }

    /**
     * Create a container with an initial draft listing the given products.
     *
     * @param request Container fields and product ids, ownerId defaults to the caller
     * @return ID of the new container
     */
    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CreatedResponse> createContainer(@Valid @RequestBody ContainerRequest request) {
        String ownerId = request.getOwnerId() != null ? request.getOwnerId() : SecurityUtils.getCurrentUserId();
        SecurityUtils.verifyOwnerAccess(ownerId);

        Long containerId = containerService.createDraft(ownerId, request.toFields(), request.getProductIds());
        logger.info("Created container {} for owner {} with {} product(s)",
                containerId, ownerId, request.getProductIds().size());

        return ResponseEntity.status(HttpStatus.CREATED).body(new CreatedResponse(containerId));
    }

    @GetMapping
    public ResponseEntity<List<ContainerRevisionResponse>> listContainers(
            @RequestParam(required = false) String ownerId
    ) {
        Actor actor = SecurityUtils.currentActor();
        List<ContainerRevisionResponse> responses = new ArrayList<>();
        for (ContainerRevision revision : containerService.listCurrent(ownerId)) {
            Container container = containerService.getBase(revision.getAggregateId());
            if (isVisible(actor, container)) {
                responses.add(ContainerRevisionResponse.fromRevision(revision, container));
            }
        }

        logger.debug("Listed {} containers (owner filter: {})", responses.size(), ownerId);
        return ResponseEntity.ok(responses);
    }

    /**
     * Get the current revision of a container with the product revisions it is pinned to.
     */
    @GetMapping("/{containerId}")
    public ResponseEntity<ContainerRevisionResponse> getContainer(@PathVariable Long containerId) {
        Container container = containerService.getBase(containerId);
        visibilityResolver.verifyVisible(SecurityUtils.currentActor(), container);
        return ResponseEntity.ok(ContainerRevisionResponse.fromRevision(containerService.getCurrent(containerId), container));
    }

    @GetMapping("/{containerId}/revisions")
    public ResponseEntity<List<ContainerRevisionResponse>> listRevisions(@PathVariable Long containerId) {
        Container container = containerService.getBaseIncludingDeleted(containerId);
        visibilityResolver.verifyVisible(SecurityUtils.currentActor(), container);

        List<ContainerRevisionResponse> responses = new ArrayList<>();
        for (ContainerRevision revision : containerService.listRevisions(containerId)) {
            responses.add(ContainerRevisionResponse.fromRevision(revision, container));
        }
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{containerId}/revisions/{revision}")
    public ResponseEntity<ContainerRevisionResponse> getRevision(
            @PathVariable Long containerId,
            @PathVariable int revision
    ) {
        Container container = containerService.getBaseIncludingDeleted(containerId);
        visibilityResolver.verifyVisible(SecurityUtils.currentActor(), container);
        return ResponseEntity.ok(ContainerRevisionResponse.fromRevision(
                containerService.getRevision(containerId, revision), container));
    }

    /**
     * Publish directly. Products are bound to their current revision at this moment.
     */
    @PutMapping("/{containerId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ContainerRevisionResponse> publishContainer(
            @PathVariable Long containerId,
            @Valid @RequestBody ContainerRequest request
    ) {
        verifyWriteAccess(containerId);

        ContainerRevision revision = containerService.publishDirect(
                containerId, request.toFields(), request.getProductIds());
        logger.info("Published container {} revision {}", containerId, revision.getRevision());

        return ResponseEntity.ok(ContainerRevisionResponse.fromRevision(revision, containerService.getBase(containerId)));
    }

    @PutMapping("/{containerId}/pending")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ContainerRevisionResponse> stageUpdate(
            @PathVariable Long containerId,
            @Valid @RequestBody ContainerRequest request
    ) {
        verifyWriteAccess(containerId);
        containerService.stageUpdate(containerId, request.toFields(), request.getProductIds());
        return getDraft(containerId);
    }

    /**
     * Get the draft. Each proposed product shows the revision it would be bound to if approved now.
     */
    @GetMapping("/{containerId}/pending")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ContainerRevisionResponse> getDraft(@PathVariable Long containerId) {
        verifyWriteAccess(containerId);
        return containerService.findDraft(containerId)
                .map(view -> ResponseEntity.ok(ContainerRevisionResponse.fromDraft(view)))
                .orElseThrow(() -> new NoDraftFoundException(containerService.family(), containerId));
    }

    @DeleteMapping("/{containerId}/pending")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> discardDraft(@PathVariable Long containerId) {
        verifyWriteAccess(containerId);
        containerService.discardDraft(containerId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{containerId}/approve")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ContainerRevisionResponse> approve(@PathVariable Long containerId) {
        verifyWriteAccess(containerId);

        ContainerRevision revision = containerService.approve(containerId);
        logger.info("Approved container {} revision {}", containerId, revision.getRevision());

        return ResponseEntity.ok(ContainerRevisionResponse.fromRevision(revision, containerService.getBase(containerId)));
    }

    @DeleteMapping("/{containerId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> deleteContainer(@PathVariable Long containerId) {
        verifyWriteAccess(containerId);
        containerService.softDelete(containerId);
        logger.info("Deleted container {}", containerId);
        return ResponseEntity.noContent().build();
    }

    private void verifyWriteAccess(Long containerId) {
        SecurityUtils.verifyOwnerAccess(containerService.getBase(containerId).getOwnerId());
    }

    private boolean isVisible(Actor actor, Container container) {
        return (actor != null && actor.isAdmin()) || visibilityResolver.resolve(actor, container).isVisible();
    }
}
