package com.ifip.exhibits.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    private String userAgent = "ExhibitCrawler/1.0 (crawler-ops@example.com)";
    private Integer startYear;
    private Integer endYear;
    private List<Integer> quarters = new ArrayList<>(List.of(1, 2, 3, 4));
    private List<String> filingTypes = new ArrayList<>(List.of("10-K", "10-Q", "8-K"));
    private List<String> exhibitTypes = new ArrayList<>(List.of("EX-10"));
    private boolean skipExisting = true;
    private int pageLimit = 50;
    private String outputPath = "data/exhibits";
    private double requestsPerSecond = 5.0;
    private int maxRetries = 5;
    private long retryBackoffMs = 500;
    private List<Integer> retryableStatuses = new ArrayList<>(List.of(400, 401, 403, 500, 502, 503, 504, 505));
    private int requestTimeoutSeconds = 60;
    private int archiveMaxInMemoryMb = 64;
    private int maxRetryPasses = 0;
    private long retryPassDelayMs = 5000;
    private boolean runOnStartup = false;

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Integer getStartYear() {
        return startYear;
    }

    public void setStartYear(Integer startYear) {
        this.startYear = startYear;
    }

    public Integer getEndYear() {
        return endYear;
    }

    public void setEndYear(Integer endYear) {
        this.endYear = endYear;
    }

    public List<Integer> getQuarters() {
        return quarters;
    }

    public void setQuarters(List<Integer> quarters) {
        this.quarters = quarters;
    }

    public List<String> getFilingTypes() {
        return filingTypes;
    }

    public void setFilingTypes(List<String> filingTypes) {
        this.filingTypes = filingTypes;
    }

    public List<String> getExhibitTypes() {
        return exhibitTypes;
    }

    public void setExhibitTypes(List<String> exhibitTypes) {
        this.exhibitTypes = exhibitTypes;
    }

    public boolean isSkipExisting() {
        return skipExisting;
    }

    public void setSkipExisting(boolean skipExisting) {
        this.skipExisting = skipExisting;
    }

    public int getPageLimit() {
        return pageLimit;
    }

    public void setPageLimit(int pageLimit) {
        this.pageLimit = pageLimit;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public double getRequestsPerSecond() {
        return requestsPerSecond;
    }

    public void setRequestsPerSecond(double requestsPerSecond) {
        this.requestsPerSecond = requestsPerSecond;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public void setRetryBackoffMs(long retryBackoffMs) {
        this.retryBackoffMs = retryBackoffMs;
    }

    public List<Integer> getRetryableStatuses() {
        return retryableStatuses;
    }

    public void setRetryableStatuses(List<Integer> retryableStatuses) {
        this.retryableStatuses = retryableStatuses;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getArchiveMaxInMemoryMb() {
        return archiveMaxInMemoryMb;
    }

    public void setArchiveMaxInMemoryMb(int archiveMaxInMemoryMb) {
        this.archiveMaxInMemoryMb = archiveMaxInMemoryMb;
    }

    public int getMaxRetryPasses() {
        return maxRetryPasses;
    }

    public void setMaxRetryPasses(int maxRetryPasses) {
        this.maxRetryPasses = maxRetryPasses;
    }

    public long getRetryPassDelayMs() {
        return retryPassDelayMs;
    }

    public void setRetryPassDelayMs(long retryPassDelayMs) {
        this.retryPassDelayMs = retryPassDelayMs;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }
}
