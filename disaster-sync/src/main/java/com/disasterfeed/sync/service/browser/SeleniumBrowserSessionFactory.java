package com.disasterfeed.sync.service.browser;

import com.disasterfeed.sync.config.DisasterSyncProperties;
import com.disasterfeed.sync.exception.FetchException;
import com.disasterfeed.sync.exception.FetchException.FetchFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.openqa.selenium.firefox.FirefoxProfile;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Starts a fresh WebDriver per session, with downloads routed to a temporary directory
 * that only that session uses.
 *
 * Selenium Manager resolves the driver binary, so nothing has to be installed up front
 * beyond the browser itself.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SeleniumBrowserSessionFactory implements BrowserSessionFactory {

    private static final String GEOJSON_MIME = "application/geo+json,application/json,application/octet-stream";

    private final DisasterSyncProperties properties;

    @Override
    public BrowserSession open() {
        Path downloadDir;
        try {
            downloadDir = Files.createTempDirectory("gdacs-download-");
        } catch (IOException e) {
            throw new FetchException(FetchFailure.BROWSER, "Cannot create download directory", e);
        }

        DisasterSyncProperties.Feed.Browser browser = properties.getFeed().getBrowser();
        try {
            WebDriver driver = createDriver(browser, downloadDir);
            log.debug("Started {} session, downloads in {}", browser.getKind(), downloadDir);
            return new SeleniumBrowserSession(driver, downloadDir);
        } catch (WebDriverException e) {
            deleteQuietly(downloadDir);
            throw new FetchException(FetchFailure.BROWSER,
                    "Could not start " + browser.getKind() + ": " + e.getMessage(), e);
        }
    }

    private WebDriver createDriver(DisasterSyncProperties.Feed.Browser browser, Path downloadDir) {
        String dir = downloadDir.toAbsolutePath().toString();
        Map<String, Object> chromiumPrefs = Map.of(
                "download.default_directory", dir,
                "download.prompt_for_download", false,
                "safebrowsing.enabled", true);

        return switch (browser.getKind()) {
            case CHROME -> {
                ChromeOptions options = new ChromeOptions();
                options.setExperimentalOption("prefs", chromiumPrefs);
                options.addArguments("--window-size=1920,1080");
                if (browser.isHeadless()) options.addArguments("--headless=new");
                yield new ChromeDriver(options);
            }
            case EDGE -> {
                EdgeOptions options = new EdgeOptions();
                options.setExperimentalOption("prefs", chromiumPrefs);
                options.addArguments("--window-size=1920,1080");
                if (browser.isHeadless()) options.addArguments("--headless=new");
                yield new EdgeDriver(options);
            }
            case FIREFOX -> {
                FirefoxProfile profile = new FirefoxProfile();
                profile.setPreference("browser.download.folderList", 2);
                profile.setPreference("browser.download.dir", dir);
                profile.setPreference("browser.download.useDownloadDir", true);
                profile.setPreference("browser.helperApps.neverAsk.saveToDisk", GEOJSON_MIME);
                FirefoxOptions options = new FirefoxOptions().setProfile(profile);
                if (browser.isHeadless()) options.addArguments("-headless");
                yield new FirefoxDriver(options);
            }
        };
    }

    private void deleteQuietly(Path dir) {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Could not remove download directory {}: {}", dir, e.getMessage());
        }
    }
}
