package com.repairdesk.sync.exception;

public class SessionNotFoundException extends SyncException {

    public SessionNotFoundException(String viewerId) {
        super("No active sync session for viewer " + viewerId);
    }
}
