package com.repairdesk.sync.model.domain;

public enum ViewerRole {
    ADMIN,
    STANDARD
}
