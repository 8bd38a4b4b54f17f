package org.assetsync.changes.wire;

/**
 * Status vocabulary of the service's background and upload jobs.
 */
public enum RemoteJobState {
    AWAITING_DATA,
    PENDING,
    IN_PROGRESS,
    DONE,
    FAILED,
    UNKNOWN;

    public static RemoteJobState fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        switch (value) {
            case "awaitingData":
                return AWAITING_DATA;
            case "pending":
                return PENDING;
            case "inProgress":
            case "inProgess": // sic, sent by some server versions
                return IN_PROGRESS;
            case "done":
                return DONE;
            case "failed":
                return FAILED;
            default:
                return UNKNOWN;
        }
    }
}
