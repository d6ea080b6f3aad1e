package com.disasterfeed.sync.service.browser;

@FunctionalInterface
public interface BrowserSessionFactory {

    BrowserSession open();
}
