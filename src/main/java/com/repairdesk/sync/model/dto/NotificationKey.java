package com.repairdesk.sync.model.dto;

/**
 * Identifies a notification by the row, the field that changed and its new value.
 * Two dispatches with equal keys are the same notification.
 */
public record NotificationKey(String entityId, String field, String newValue) {

    @Override
    public String toString() {
        return entityId + ":" + field + "=" + newValue;
    }
}
