package com.repairdesk.sync.model.dto;

/**
 * What applying one change did to the viewer's collections.
 *
 * @param mine effect on the "mine" collection
 * @param all  effect on the "all" collection, null for standard viewers
 */
public record ViewDelta(Delta mine, Delta all) {

    public enum Delta {
        NONE,
        INSERTED,
        REPLACED,
        REMOVED
    }

    public static ViewDelta none(boolean admin) {
        return new ViewDelta(Delta.NONE, admin ? Delta.NONE : null);
    }

    public boolean changedAnything() {
        return mine != Delta.NONE || (all != null && all != Delta.NONE);
    }
}
