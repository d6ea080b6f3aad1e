package com.disasterfeed.sync.model;

/**
 * A single upstream record that was skipped or only partially usable.
 *
 * @param index      zero-based position of the record in its document
 * @param identifier source id when it could be resolved, otherwise null
 */
public record ParseWarning(FeedFormat format, int index, String identifier, String reason) {

    @Override
    public String toString() {
        return format + "[" + index + "]" + (identifier != null ? " " + identifier : "") + ": " + reason;
    }
}
