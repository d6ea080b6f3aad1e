package com.disasterfeed.sync.exception;

import com.disasterfeed.sync.model.FailureKind;
import com.disasterfeed.sync.model.FeedFormat;

/**
 * The document as a whole is unusable (empty body, not well-formed, wrong root).
 * Single bad records are reported as ParseWarnings instead.
 */
public class FeedParseException extends SyncException {

    private final FeedFormat format;

    public FeedParseException(FeedFormat format, String message) {
        super(format + " " + message);
        this.format = format;
    }

    public FeedParseException(FeedFormat format, String message, Throwable cause) {
        super(format + " " + message, cause);
        this.format = format;
    }

    public FeedFormat getFormat() {
        return format;
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.PARSE;
    }
}
