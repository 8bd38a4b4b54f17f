package org.assetsync.changes.polling;

import java.time.Duration;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Retry budget for polling a resource that becomes ready asynchronously.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class PollingSettings {
    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(5);

    @Builder.Default
    private final int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    @Builder.Default
    private final Duration delay = DEFAULT_DELAY;

    public static PollingSettings defaults() {
        return PollingSettings.builder().build();
    }

    public static PollingSettings of(int maxAttempts, Duration delay) {
        return PollingSettings.builder().maxAttempts(maxAttempts).delay(delay).build();
    }
}
