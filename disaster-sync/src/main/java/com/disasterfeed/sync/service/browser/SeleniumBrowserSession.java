package com.disasterfeed.sync.service.browser;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

@Slf4j
class SeleniumBrowserSession implements BrowserSession {

    private final WebDriver driver;
    private final Path downloadDirectory;

    SeleniumBrowserSession(WebDriver driver, Path downloadDirectory) {
        this.driver = driver;
        this.downloadDirectory = downloadDirectory;
    }

    @Override
    public void load(String url, Duration timeout) {
        driver.manage().timeouts().pageLoadTimeout(timeout);
        driver.get(url);
        new WebDriverWait(driver, timeout).until(d ->
                "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));
    }

    @Override
    public void scrollToElement(String elementId, int offset) {
        WebElement anchor = driver.findElement(By.id(elementId));
        int target = Math.max(0, anchor.getLocation().getY() + offset);
        ((JavascriptExecutor) driver).executeScript("window.scrollTo(0, arguments[0]);", target);
    }

    @Override
    public void clickWhenClickable(String xpath, Duration timeout) {
        new WebDriverWait(driver, timeout)
                .until(ExpectedConditions.elementToBeClickable(By.xpath(xpath)))
                .click();
    }

    @Override
    public Path downloadDirectory() {
        return downloadDirectory;
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Browser did not quit cleanly: {}", e.getMessage());
        } finally {
            try {
                FileSystemUtils.deleteRecursively(downloadDirectory);
            } catch (IOException e) {
                log.warn("Could not remove download directory {}: {}", downloadDirectory, e.getMessage());
            }
        }
    }
}
