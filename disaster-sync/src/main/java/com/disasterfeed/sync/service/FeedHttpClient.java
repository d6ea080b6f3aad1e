package com.disasterfeed.sync.service;

import com.disasterfeed.sync.exception.FetchException;
import com.disasterfeed.sync.exception.FetchException.FetchFailure;
import com.disasterfeed.sync.model.FeedFormat;
import com.disasterfeed.sync.model.FeedPayload;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Clock;

/**
 * Thin client for the direct-download GDACS endpoints (the RSS/XML feed, and the GeoJSON
 * export when it is served without the browser).
 *
 * Connect and read timeouts come from the RestTemplate. Every transport problem is mapped
 * to a {@link FetchException}; the Resilience4j "gdacsFeed" instance retries those with
 * exponential backoff before the cycle gives up.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FeedHttpClient {

    private final RestTemplate feedRestTemplate;
    private final Clock clock;

    @Retry(name = "gdacsFeed")
    public FeedPayload get(FeedFormat format, String url) {
        log.debug("Fetching {} feed: {}", format, url);
        try {
            ResponseEntity<byte[]> response = feedRestTemplate.getForEntity(URI.create(url), byte[].class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new FetchException(FetchFailure.HTTP_STATUS,
                        format + " feed returned HTTP " + response.getStatusCode().value());
            }
            byte[] body = response.getBody() != null ? response.getBody() : new byte[0];
            log.debug("{} feed returned {} bytes", format, body.length);
            return new FeedPayload(format, body, url, clock.instant());

        } catch (HttpStatusCodeException e) {
            throw new FetchException(FetchFailure.HTTP_STATUS,
                    format + " feed returned HTTP " + e.getStatusCode().value(), e);

        } catch (ResourceAccessException e) {
            FetchFailure failure = isTimeout(e) ? FetchFailure.TIMEOUT : FetchFailure.NETWORK;
            throw new FetchException(failure, format + " feed unreachable: " + e.getMessage(), e);

        } catch (RestClientException e) {
            throw new FetchException(FetchFailure.NETWORK, format + " feed request failed: " + e.getMessage(), e);
        }
    }

    private boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
