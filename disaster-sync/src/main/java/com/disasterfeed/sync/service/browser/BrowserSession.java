package com.disasterfeed.sync.service.browser;

import java.nio.file.Path;
import java.time.Duration;

/**
 * One scripted browser, owned by a single fetch call and closed by it.
 * Closing quits the browser and removes the download directory.
 */
public interface BrowserSession extends AutoCloseable {

    /** Navigate and block until the document reports readyState=complete, or the timeout elapses. */
    void load(String url, Duration timeout);

    /** Scroll so the element with the given id sits {@code offset} pixels from the top of the viewport. */
    void scrollToElement(String elementId, int offset);

    /** Wait until the element is clickable, then click it. */
    void clickWhenClickable(String xpath, Duration timeout);

    /** Directory the browser saves downloads into; private to this session. */
    Path downloadDirectory();

    @Override
    void close();
}
