package org.assetsync.changes.polling;

import org.assetsync.client.common.ApiException;

import lombok.Getter;

/**
 * The polling budget ran out before the resource became ready.
 */
@Getter
public class PollingTimeoutException extends ApiException {
    private final String target;
    private final int attempts;

    public PollingTimeoutException(String target, int attempts) {
        super(target + " was not ready after " + attempts + " attempt(s)");
        this.target = target;
        this.attempts = attempts;
    }

    public PollingTimeoutException(String target, Throwable cause) {
        super(target + " was not ready before the deadline", cause);
        this.target = target;
        this.attempts = -1;
    }
}
