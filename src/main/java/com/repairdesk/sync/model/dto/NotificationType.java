package com.repairdesk.sync.model.dto;

public enum NotificationType {
    NEW_BOOKING,
    BOOKING_STATUS_CHANGED,
    NEW_QUOTE_REQUEST,
    QUOTE_STATUS_CHANGED,
    NEW_MESSAGE
}
