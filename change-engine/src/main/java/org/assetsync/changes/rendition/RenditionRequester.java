package org.assetsync.changes.rendition;

import java.util.Map;

import org.assetsync.changes.ChangeEngineSettings;
import org.assetsync.changes.polling.PollingRetrier;
import org.assetsync.client.common.ApiException;
import org.assetsync.client.common.DamApiClient;
import org.assetsync.client.common.http.HttpResponse;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Asks the service to render an asset and waits, within the rendition polling budget,
 * until the rendered file can be downloaded.
 */
@Slf4j
public class RenditionRequester {
    static final String RENDITION_REQUEST_CONTENT_TYPE = "application/vnd.fotoware.rendition-request+json";
    private static final String LOCATION_HEADER_NAME = "Location";

    private final DamApiClient client;
    private final PollingRetrier pollingRetrier;
    private final ChangeEngineSettings settings;

    public RenditionRequester(DamApiClient client, PollingRetrier pollingRetrier, ChangeEngineSettings settings) {
        this.client = client;
        this.pollingRetrier = pollingRetrier;
        this.settings = settings;
    }

    /**
     * @param renditionHref the href of one of the asset's renditions
     * @return the ready response; its body is the rendered file
     */
    public Mono<HttpResponse> requestRendition(String renditionHref) {
        return client.post(settings.getRenditionServicePath(), RENDITION_REQUEST_CONTENT_TYPE,
                Map.of("href", renditionHref))
            .flatMap(response -> {
                var location = response.getHeader(LOCATION_HEADER_NAME);
                if (location == null || location.isBlank()) {
                    return Mono.error(new ApiException("Rendition request for " + renditionHref
                        + " returned no Location"));
                }
                log.debug("Rendition of {} will be served at {}", renditionHref, location);
                return pollingRetrier.pollUntilReady(location,
                    settings.getRenditionPolling().getMaxAttempts(),
                    settings.getRenditionPolling().getDelay());
            });
    }
}
