package com.repairdesk.sync.model.domain;

import java.util.Objects;

/**
 * The (role, viewer) pair that decides which collections an event is routed into.
 *
 * @param role     the viewer's role
 * @param viewerId id of the signed-in user
 */
public record ViewScope(ViewerRole role, String viewerId) {

    public ViewScope {
        Objects.requireNonNull(role, "role");
        if (viewerId == null || viewerId.isBlank()) {
            throw new IllegalArgumentException("viewerId must not be blank");
        }
    }

    public static ViewScope admin(String viewerId) {
        return new ViewScope(ViewerRole.ADMIN, viewerId);
    }

    public static ViewScope standard(String viewerId) {
        return new ViewScope(ViewerRole.STANDARD, viewerId);
    }

    public boolean isAdmin() {
        return role == ViewerRole.ADMIN;
    }

    public boolean owns(TrackedEntity entity) {
        return entity != null && entity.isOwnedBy(viewerId);
    }

    /**
     * Whether a row belongs in this viewer's cache at all.
     */
    public boolean canSee(TrackedEntity entity) {
        return isAdmin() || owns(entity);
    }
}
