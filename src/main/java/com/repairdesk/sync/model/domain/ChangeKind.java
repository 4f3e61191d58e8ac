package com.repairdesk.sync.model.domain;

public enum ChangeKind {
    INSERT,
    UPDATE,
    DELETE;

    public static ChangeKind fromWire(String value) {
        if (value == null) {
            return null;
        }
        try {
            return ChangeKind.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
