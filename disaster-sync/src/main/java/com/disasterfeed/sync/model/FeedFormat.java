package com.disasterfeed.sync.model;

public enum FeedFormat {
    GEOJSON, XML
}
