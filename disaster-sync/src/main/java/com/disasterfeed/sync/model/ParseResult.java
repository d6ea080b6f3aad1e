package com.disasterfeed.sync.model;

import java.util.List;

public record ParseResult(List<DisasterEvent> events, List<ParseWarning> warnings) {

    public ParseResult {
        events = List.copyOf(events);
        warnings = List.copyOf(warnings);
    }
}
