package com.disasterfeed.sync.service;

import com.disasterfeed.sync.config.DisasterSyncProperties;
import com.disasterfeed.sync.exception.FetchException;
import com.disasterfeed.sync.exception.FetchException.FetchFailure;
import com.disasterfeed.sync.exception.SyncException;
import com.disasterfeed.sync.model.FeedFormat;
import com.disasterfeed.sync.model.FeedPayload;
import com.disasterfeed.sync.model.FeedSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Fetches both upstream representations of the feed.
 *
 * The two fetches share nothing, so by default they run side by side on the feed-fetch
 * executor. We always wait for both to settle before reporting, so no fetch (or browser)
 * outlives the cycle that started it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SourceClient {

    private final FeedHttpClient httpClient;
    private final BrowserGeoJsonFetcher browserFetcher;
    private final DisasterSyncProperties properties;
    private final ExecutorService feedFetchExecutor;

    public FeedPayload fetchXml() {
        return httpClient.get(FeedFormat.XML, properties.getFeed().getXmlUrl());
    }

    public FeedPayload fetchGeoJson() {
        DisasterSyncProperties.Feed feed = properties.getFeed();
        return switch (feed.getGeojsonMode()) {
            case HTTP -> httpClient.get(FeedFormat.GEOJSON, feed.getGeojsonUrl());
            case BROWSER -> browserFetcher.fetch(feed.getGeojsonUrl());
        };
    }

    public FeedSnapshot fetchAll() {
        if (!properties.getFeed().isParallelFetch()) {
            FeedPayload geoJson = fetchGeoJson();
            return new FeedSnapshot(geoJson, fetchXml());
        }

        CompletableFuture<FeedPayload> geoJson = CompletableFuture.supplyAsync(this::fetchGeoJson, feedFetchExecutor);
        CompletableFuture<FeedPayload> xml = CompletableFuture.supplyAsync(this::fetchXml, feedFetchExecutor);
        try {
            CompletableFuture.allOf(geoJson, xml).join();
        } catch (CompletionException e) {
            // allOf reports one failure; surface the GeoJSON one first for a stable message
            throw unwrap(geoJson.isCompletedExceptionally() ? failureOf(geoJson) : failureOf(xml));
        }
        FeedSnapshot snapshot = new FeedSnapshot(geoJson.join(), xml.join());
        log.info("Fetched GeoJSON ({} bytes) and XML ({} bytes)",
                snapshot.geoJson().size(), snapshot.xml().size());
        return snapshot;
    }

    private Throwable failureOf(CompletableFuture<FeedPayload> future) {
        try {
            future.join();
            return new IllegalStateException("future completed normally");
        } catch (CompletionException e) {
            return e.getCause() != null ? e.getCause() : e;
        }
    }

    private RuntimeException unwrap(Throwable cause) {
        if (cause instanceof SyncException syncException) {
            return syncException;
        }
        return new FetchException(FetchFailure.NETWORK, "Feed fetch failed: " + cause.getMessage(), cause);
    }
}
