package com.cred.freestyle.catalog.api.controller;

import com.cred.freestyle.catalog.api.dto.CreatedResponse;
import com.cred.freestyle.catalog.api.dto.PointOfSaleRequest;
import com.cred.freestyle.catalog.api.dto.PointOfSaleRevisionResponse;
import com.cred.freestyle.catalog.domain.model.PointOfSaleRevision;
import com.cred.freestyle.catalog.exception.NoDraftFoundException;
import com.cred.freestyle.catalog.security.Actor;
import com.cred.freestyle.catalog.security.SecurityUtils;
import com.cred.freestyle.catalog.service.PointOfSaleService;
import com.cred.freestyle.catalog.service.VisibilityResolver;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for points of sale.
 *
 * @author Catalog Team
 */
@RestController
@RequestMapping("/api/v1/points-of-sale")
public class PointOfSaleController {

    private static final Logger logger = LoggerFactory.getLogger(PointOfSaleController.class);

    private final PointOfSaleService pointOfSaleService;
    private final VisibilityResolver visibilityResolver;

    public PointOfSaleController(PointOfSaleService pointOfSaleService, VisibilityResolver visibilityResolver) {
        this.pointOfSaleService = pointOfSaleService;
        this.visibilityResolver = visibilityResolver;
    }

    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CreatedResponse> createPointOfSale(@Valid @RequestBody PointOfSaleRequest request) {
        String ownerId = request.getOwnerId() != null ? request.getOwnerId() : SecurityUtils.getCurrentUserId();
        SecurityUtils.verifyOwnerAccess(ownerId);

        Long pointOfSaleId = pointOfSaleService.createDraft(ownerId, request.toFields(), request.getContainerIds());
        logger.info("Created point of sale {} for owner {}", pointOfSaleId, ownerId);

        return ResponseEntity.status(HttpStatus.CREATED).body(new CreatedResponse(pointOfSaleId));
    }

    @GetMapping
    public ResponseEntity<List<PointOfSaleRevisionResponse>> listPointsOfSale(
            @RequestParam(required = false) String ownerId
    ) {
        Actor actor = SecurityUtils.currentActor();
        List<PointOfSaleRevisionResponse> responses = pointOfSaleService.listCurrent(ownerId).stream()
                .filter(revision -> (actor != null && actor.isAdmin()) || visibilityResolver
                        .resolve(actor, pointOfSaleService.getBase(revision.getAggregateId())).isVisible())
                .map(PointOfSaleRevisionResponse::fromRevision)
                .collect(Collectors.toList());
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{pointOfSaleId}")
    public ResponseEntity<PointOfSaleRevisionResponse> getPointOfSale(@PathVariable Long pointOfSaleId) {
        visibilityResolver.verifyVisible(SecurityUtils.currentActor(), pointOfSaleService.getBase(pointOfSaleId));
        return ResponseEntity.ok(PointOfSaleRevisionResponse.fromRevision(pointOfSaleService.getCurrent(pointOfSaleId)));
    }

    @GetMapping("/{pointOfSaleId}/revisions")
    public ResponseEntity<List<PointOfSaleRevisionResponse>> listRevisions(@PathVariable Long pointOfSaleId) {
        visibilityResolver.verifyVisible(SecurityUtils.currentActor(),
                pointOfSaleService.getBaseIncludingDeleted(pointOfSaleId));
        return ResponseEntity.ok(pointOfSaleService.listRevisions(pointOfSaleId).stream()
                .map(PointOfSaleRevisionResponse::fromRevision)
                .collect(Collectors.toList()));
    }

    /**
     * Get one historical revision, e.g. the one an issued invoice was printed against.
     */
    @GetMapping("/{pointOfSaleId}/revisions/{revision}")
    public ResponseEntity<PointOfSaleRevisionResponse> getRevision(
            @PathVariable Long pointOfSaleId,
            @PathVariable int revision
    ) {
        visibilityResolver.verifyVisible(SecurityUtils.currentActor(),
                pointOfSaleService.getBaseIncludingDeleted(pointOfSaleId));
        return ResponseEntity.ok(PointOfSaleRevisionResponse.fromRevision(
                pointOfSaleService.getRevision(pointOfSaleId, revision)));
    }

    @PutMapping("/{pointOfSaleId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PointOfSaleRevisionResponse> publishPointOfSale(
            @PathVariable Long pointOfSaleId,
            @Valid @RequestBody PointOfSaleRequest request
    ) {
        verifyWriteAccess(pointOfSaleId);

        PointOfSaleRevision revision = pointOfSaleService.publishDirect(
                pointOfSaleId, request.toFields(), request.getContainerIds());
        logger.info("Published point of sale {} revision {}", pointOfSaleId, revision.getRevision());

        return ResponseEntity.ok(PointOfSaleRevisionResponse.fromRevision(revision));
    }

    @PutMapping("/{pointOfSaleId}/pending")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PointOfSaleRevisionResponse> stageUpdate(
            @PathVariable Long pointOfSaleId,
            @Valid @RequestBody PointOfSaleRequest request
    ) {
        verifyWriteAccess(pointOfSaleId);
        pointOfSaleService.stageUpdate(pointOfSaleId, request.toFields(), request.getContainerIds());
        return getDraft(pointOfSaleId);
    }

    @GetMapping("/{pointOfSaleId}/pending")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PointOfSaleRevisionResponse> getDraft(@PathVariable Long pointOfSaleId) {
        verifyWriteAccess(pointOfSaleId);
        return pointOfSaleService.findDraft(pointOfSaleId)
                .map(view -> ResponseEntity.ok(PointOfSaleRevisionResponse.fromDraft(view)))
                .orElseThrow(() -> new NoDraftFoundException(pointOfSaleService.family(), pointOfSaleId));
    }

    @DeleteMapping("/{pointOfSaleId}/pending")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> discardDraft(@PathVariable Long pointOfSaleId) {
        verifyWriteAccess(pointOfSaleId);
        pointOfSaleService.discardDraft(pointOfSaleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{pointOfSaleId}/approve")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PointOfSaleRevisionResponse> approve(@PathVariable Long pointOfSaleId) {
        verifyWriteAccess(pointOfSaleId);

        PointOfSaleRevision revision = pointOfSaleService.approve(pointOfSaleId);
        logger.info("Approved point of sale {} revision {}", pointOfSaleId, revision.getRevision());

        return ResponseEntity.ok(PointOfSaleRevisionResponse.fromRevision(revision));
    }

    @DeleteMapping("/{pointOfSaleId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> deletePointOfSale(@PathVariable Long pointOfSaleId) {
        verifyWriteAccess(pointOfSaleId);
        pointOfSaleService.softDelete(pointOfSaleId);
        logger.info("Deleted point of sale {}", pointOfSaleId);
        return ResponseEntity.noContent().build();
    }

    private void verifyWriteAccess(Long pointOfSaleId) {
        SecurityUtils.verifyOwnerAccess(pointOfSaleService.getBase(pointOfSaleId).getOwnerId());
    }
}
