package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.RevisionedBase;
import com.cred.freestyle.catalog.security.Actor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;

/**
 * Decides who can see an aggregate and which aggregates propagation may republish.
 *
 * @author Catalog Team
 */
@Service
public class VisibilityResolver {

    private static final Logger logger = LoggerFactory.getLogger(VisibilityResolver.class);

    private final OwnerDirectory ownerDirectory;

    public VisibilityResolver(OwnerDirectory ownerDirectory) {
        this.ownerDirectory = ownerDirectory;
    }

    /**
     * Resolve the visibility of an aggregate for an actor.
     * Ownership wins over the public flag, which wins over organization membership.
     *
     * @param actor Caller, null for anonymous requests
     * @param base Aggregate base record
     * @return Visibility, NONE if the actor may not see the aggregate
     */
    public Visibility resolve(Actor actor, RevisionedBase base) {
        if (actor != null && actor.getId().equals(base.getOwnerId())) {
            return Visibility.OWNED;
        }
        if (base.isPubliclyVisible()) {
            return Visibility.PUBLIC;
        }
        if (actor != null && actor.isMemberOf(base.getOwnerId())) {
            return Visibility.ORGANIZATIONAL;
        }
        return Visibility.NONE;
    }

    /**
     * Throw unless the actor can see the aggregate. Admins see everything.
     *
     * @throws AccessDeniedException if the aggregate is not visible to the actor
     */
    public void verifyVisible(Actor actor, RevisionedBase base) {
        if (actor != null && actor.isAdmin()) {
            return;
        }
        if (!resolve(actor, base).isVisible()) {
            logger.warn("Actor {} cannot see aggregate {} of owner {}",
                    actor == null ? "anonymous" : actor.getId(), base.getId(), base.getOwnerId());
            throw new AccessDeniedException("Access denied: aggregate " + base.getId() + " is not visible");
        }
    }

    /**
     * Whether propagation may republish this aggregate.
     * Deleted aggregates and aggregates of deactivated owners are left at their current revision.
     *
     * @param base Parent base record
     * @return true if the parent should follow its children's changes
     */
    public boolean isPropagationTarget(RevisionedBase base) {
        if (base.isDeleted()) {
            return false;
        }
        return !ownerDirectory.isDeactivated(base.getOwnerId());
    }
}
