package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import java.util.Objects;

/**
 * Identifies a call within a cluster: the node that created the call plus the global call id it assigned.
 *
 * @param callManagerId The cluster node identifier (globalCallID_callManagerId).
 * @param globalCallId  The call identifier assigned by that node (globalCallID_callId).
 */
public record CallId(String callManagerId, String globalCallId) {

    public CallId {
        Objects.requireNonNull(callManagerId, "callManagerId cannot be null");
        Objects.requireNonNull(globalCallId, "globalCallId cannot be null");
    }

    @Override
    public String toString() {
        return callManagerId + "-" + globalCallId;
    }
}
