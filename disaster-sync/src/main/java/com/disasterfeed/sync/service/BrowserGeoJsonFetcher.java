package com.disasterfeed.sync.service;

import com.disasterfeed.sync.config.DisasterSyncProperties;
import com.disasterfeed.sync.exception.FetchException;
import com.disasterfeed.sync.exception.FetchException.FetchFailure;
import com.disasterfeed.sync.model.FeedFormat;
import com.disasterfeed.sync.model.FeedPayload;
import com.disasterfeed.sync.service.browser.BrowserSession;
import com.disasterfeed.sync.service.browser.BrowserSessionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriverException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Downloads the GeoJSON export from the GDACS alert search page.
 *
 * The page builds the file client-side, so we drive a real browser:
 *   load page -> scroll the search panel into view -> wait for the download link to be
 *   clickable -> click -> wait for a finished *.geojson file in the session's download dir.
 *
 * Every wait is bounded by feed.browser.timeout and fails with FetchException(TIMEOUT).
 * The session is closed on every path out of {@link #fetch(String)}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BrowserGeoJsonFetcher {

    private static final List<String> PARTIAL_SUFFIXES = List.of(".crdownload", ".part", ".tmp");

    private final BrowserSessionFactory sessionFactory;
    private final DisasterSyncProperties properties;
    private final Clock clock;

    public FeedPayload fetch(String url) {
        DisasterSyncProperties.Feed.Browser browser = properties.getFeed().getBrowser();
        Duration timeout = browser.getTimeout();

        log.debug("Opening browser session for {}", url);
        try (BrowserSession session = sessionFactory.open()) {
            session.load(url, timeout);
            session.scrollToElement(browser.getScrollAnchorId(), browser.getScrollOffset());
            session.clickWhenClickable(browser.getDownloadLinkXpath(), timeout);

            Path file = awaitDownload(session.downloadDirectory(), timeout, browser.getPollInterval());
            byte[] body = Files.readAllBytes(file);
            log.debug("GeoJSON download complete: {} ({} bytes)", file.getFileName(), body.length);
            return new FeedPayload(FeedFormat.GEOJSON, body, url, clock.instant());

        } catch (TimeoutException e) {
            throw new FetchException(FetchFailure.TIMEOUT,
                    "GeoJSON page not ready within " + timeout, e);
        } catch (WebDriverException e) {
            throw new FetchException(FetchFailure.BROWSER, "Browser automation failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new FetchException(FetchFailure.BROWSER, "Cannot read downloaded GeoJSON: " + e.getMessage(), e);
        }
    }

    private Path awaitDownload(Path dir, Duration timeout, Duration pollInterval) throws IOException {
        Instant deadline = clock.instant().plus(timeout);
        while (true) {
            Optional<Path> done = completedDownload(dir);
            if (done.isPresent()) {
                return done.get();
            }
            if (!clock.instant().isBefore(deadline)) {
                throw new FetchException(FetchFailure.TIMEOUT,
                        "No GeoJSON download appeared within " + timeout);
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(FetchFailure.INTERRUPTED, "Interrupted waiting for GeoJSON download", e);
            }
        }
    }

    /** Newest *.geojson once no partial download is left in the directory. */
    private Optional<Path> completedDownload(Path dir) throws IOException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.filter(Files::isRegularFile).collect(Collectors.toList());
        }
        boolean inProgress = files.stream()
                .map(p -> p.getFileName().toString())
                .anyMatch(name -> PARTIAL_SUFFIXES.stream().anyMatch(name::endsWith));
        if (inProgress) {
            return Optional.empty();
        }
        Optional<Path> newest = Optional.empty();
        long newestModified = Long.MIN_VALUE;
        for (Path p : files) {
            if (!p.getFileName().toString().endsWith(".geojson") || Files.size(p) == 0) continue;
            long modified = Files.getLastModifiedTime(p).toMillis();
            if (modified > newestModified) {
                newestModified = modified;
                newest = Optional.of(p);
            }
        }
        return newest;
    }
}
