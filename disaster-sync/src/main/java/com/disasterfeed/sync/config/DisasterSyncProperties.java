package com.disasterfeed.sync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "disaster-sync")
@Data
public class DisasterSyncProperties {

    private Feed feed = new Feed();
    private Store store = new Store();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Feed {
        private String xmlUrl = "https://www.gdacs.org/xml/rss.xml";
        private String geojsonUrl = "https://www.gdacs.org/Alerts/default.aspx";
        private GeoJsonMode geojsonMode = GeoJsonMode.BROWSER;
        private boolean parallelFetch = true;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        private Browser browser = new Browser();

        @Data
        public static class Browser {
            private BrowserKind kind = BrowserKind.CHROME;
            private boolean headless = true;
            /** Upper bound for each wait: page readiness, clickable link, finished download. */
            private Duration timeout = Duration.ofSeconds(60);
            private Duration pollInterval = Duration.ofMillis(500);
            private String scrollAnchorId = "contentSearch";
            private int scrollOffset = -50;
            private String downloadLinkXpath = "//a[@href='javascript:onclick=downloadResult();']";
        }

        public enum GeoJsonMode {
            BROWSER, HTTP
        }

        public enum BrowserKind {
            CHROME, FIREFOX, EDGE
        }
    }

    @Data
    public static class Store {
        private String eventsTable = "disaster_events";
        private String runsTable = "sync_runs";
        private int srid = 4326;
        private int batchSize = 500;
        private Duration queryTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Scheduling {
        private Duration interval = Duration.ofHours(24);
        private int failureThreshold = 3;
        private boolean failFastOnStartup = false;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }
}
