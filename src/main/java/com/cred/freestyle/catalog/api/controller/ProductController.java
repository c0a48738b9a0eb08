package com.cred.freestyle.catalog.api.controller;

import com.cred.freestyle.catalog.api.dto.CreatedResponse;
import com.cred.freestyle.catalog.api.dto.ProductRequest;
import com.cred.freestyle.catalog.api.dto.ProductRevisionResponse;
import com.cred.freestyle.catalog.domain.model.Product;
import com.cred.freestyle.catalog.domain.model.ProductRevision;
import com.cred.freestyle.catalog.exception.NoDraftFoundException;
import com.cred.freestyle.catalog.security.Actor;
import com.cred.freestyle.catalog.security.SecurityUtils;
import com.cred.freestyle.catalog.service.ProductService;
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
 * REST controller for products.
 *
 * Reads are filtered by visibility. Writes require the caller to be the owner,
 * a member of the owning organization, or an admin.
 *
 * @author Catalog Team
 */
@RestController
@RequestMapping("/api/v1/products")
public class ProductController {

    private static final Logger logger = LoggerFactory.getLogger(ProductController.class);

    private final ProductService productService;
    private final VisibilityResolver visibilityResolver;

    public ProductController(ProductService productService, VisibilityResolver visibilityResolver) {
        this.productService = productService;
        this.visibilityResolver = visibilityResolver;
    }

    /**
     * Create a product with an initial draft. Nothing is published until the draft is approved.
     *
     * @param request Product fields, ownerId defaults to the caller
     * @return ID of the new product
     */
    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CreatedResponse> createProduct(@Valid @RequestBody ProductRequest request) {
        String ownerId = request.getOwnerId() != null ? request.getOwnerId() : SecurityUtils.getCurrentUserId();
        SecurityUtils.verifyOwnerAccess(ownerId);

        Long productId = productService.createDraft(ownerId, request.toFields());
        logger.info("Created product {} for owner {}", productId, ownerId);

        return ResponseEntity.status(HttpStatus.CREATED).body(new CreatedResponse(productId));
    }

    /**
     * List the current revision of every product visible to the caller.
     *
     * @param ownerId Optional owner filter
     */
    @GetMapping
    public ResponseEntity<List<ProductRevisionResponse>> listProducts(
            @RequestParam(required = false) String ownerId
    ) {
        Actor actor = SecurityUtils.currentActor();
        List<ProductRevisionResponse> responses = productService.listCurrent(ownerId).stream()
                .filter(revision -> isVisible(actor, revision.getAggregateId()))
                .map(ProductRevisionResponse::fromRevision)
                .collect(Collectors.toList());

        logger.debug("Listed {} products (owner filter: {})", responses.size(), ownerId);
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{productId}")
    public ResponseEntity<ProductRevisionResponse> getProduct(@PathVariable Long productId) {
        visibilityResolver.verifyVisible(SecurityUtils.currentActor(), productService.getBase(productId));
        return ResponseEntity.ok(ProductRevisionResponse.fromRevision(productService.getCurrent(productId)));
    }

    /**
     * Get every published revision of a product, oldest first.
     */
    @GetMapping("/{productId}/revisions")
    public ResponseEntity<List<ProductRevisionResponse>> listRevisions(@PathVariable Long productId) {
        visibilityResolver.verifyVisible(SecurityUtils.currentActor(), productService.getBaseIncludingDeleted(productId));
        List<ProductRevisionResponse> responses = productService.listRevisions(productId).stream()
                .map(ProductRevisionResponse::fromRevision)
                .collect(Collectors.toList());
        return ResponseEntity.ok(responses);
    }

    /**
     * Get one historical revision. Works for deleted products too.
     */
    @GetMapping("/{productId}/revisions/{revision}")
    public ResponseEntity<ProductRevisionResponse> getRevision(
            @PathVariable Long productId,
            @PathVariable int revision
    ) {
        visibilityResolver.verifyVisible(SecurityUtils.currentActor(), productService.getBaseIncludingDeleted(productId));
        return ResponseEntity.ok(ProductRevisionResponse.fromRevision(productService.getRevision(productId, revision)));
    }

    /**
     * Publish new values directly, bypassing the draft.
     * Containers listing the previous revision are republished.
     */
    @PutMapping("/{productId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ProductRevisionResponse> publishProduct(
            @PathVariable Long productId,
            @Valid @RequestBody ProductRequest request
    ) {
        verifyWriteAccess(productId);

        ProductRevision revision = productService.publishDirect(productId, request.toFields());
        logger.info("Published product {} revision {}", productId, revision.getRevision());

        return ResponseEntity.ok(ProductRevisionResponse.fromRevision(revision));
    }

    @PutMapping("/{productId}/pending")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ProductRevisionResponse> stageUpdate(
            @PathVariable Long productId,
            @Valid @RequestBody ProductRequest request
    ) {
        verifyWriteAccess(productId);
        return ResponseEntity.ok(ProductRevisionResponse.fromDraft(
                productService.stageUpdate(productId, request.toFields())));
    }

    @GetMapping("/{productId}/pending")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ProductRevisionResponse> getDraft(@PathVariable Long productId) {
        verifyWriteAccess(productId);
        return productService.findDraft(productId)
                .map(view -> ResponseEntity.ok(ProductRevisionResponse.fromDraft(view.getDraft())))
                .orElseThrow(() -> new NoDraftFoundException(productService.family(), productId));
    }

    @DeleteMapping("/{productId}/pending")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> discardDraft(@PathVariable Long productId) {
        verifyWriteAccess(productId);
        productService.discardDraft(productId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Approve the draft into a new revision.
     */
    @PostMapping("/{productId}/approve")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ProductRevisionResponse> approve(@PathVariable Long productId) {
        verifyWriteAccess(productId);

        ProductRevision revision = productService.approve(productId);
        logger.info("Approved product {} revision {}", productId, revision.getRevision());

        return ResponseEntity.ok(ProductRevisionResponse.fromRevision(revision));
    }

    /**
     * Soft-delete a product and remove it from the current revision of every container.
     */
    @DeleteMapping("/{productId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> deleteProduct(@PathVariable Long productId) {
        verifyWriteAccess(productId);
        productService.softDelete(productId);
        logger.info("Deleted product {}", productId);
        return ResponseEntity.noContent().build();
    }

    private void verifyWriteAccess(Long productId) {
        Product product = productService.getBase(productId);
        SecurityUtils.verifyOwnerAccess(product.getOwnerId());
    }

    private boolean isVisible(Actor actor, Long productId) {
        if (actor != null && actor.isAdmin()) {
            return true;
        }
        return visibilityResolver.resolve(actor, productService.getBase(productId)).isVisible();
    }
}
