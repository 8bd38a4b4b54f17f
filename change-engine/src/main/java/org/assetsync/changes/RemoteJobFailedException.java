package org.assetsync.changes;

import org.assetsync.client.common.ApiException;

/**
 * A background job reported that it failed.
 */
public class RemoteJobFailedException extends ApiException {
    public RemoteJobFailedException(String statusLocation, String reason) {
        super("Job at " + statusLocation + " failed: " + reason);
    }
}
