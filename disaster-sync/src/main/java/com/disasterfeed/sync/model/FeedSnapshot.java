package com.disasterfeed.sync.model;

/** Both upstream documents from one fetch stage. */
public record FeedSnapshot(FeedPayload geoJson, FeedPayload xml) {}
