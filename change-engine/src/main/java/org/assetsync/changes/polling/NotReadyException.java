package org.assetsync.changes.polling;

/**
 * Signals a poll attempt that found the resource still processing. Consumed by the
 * {@link PollingRetrier}; it never escapes a poll.
 */
public class NotReadyException extends RuntimeException {
    public NotReadyException(String what) {
        super(what + " is not ready yet", null, false, false);
    }
}
