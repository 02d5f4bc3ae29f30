package com.ifip.exhibits.batch;

import com.ifip.exhibits.config.CrawlerProperties;
import com.ifip.exhibits.domain.CrawlRequest;
import com.ifip.exhibits.service.CrawlJobService;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class CrawlStartupRunner implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(CrawlStartupRunner.class);

    private final CrawlerProperties properties;
    private final CrawlJobService crawlJobService;

    public CrawlStartupRunner(CrawlerProperties properties, CrawlJobService crawlJobService) {
        this.properties = properties;
        this.crawlJobService = crawlJobService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            return;
        }
        if (properties.getStartYear() == null) {
            LOGGER.warn("Startup crawl enabled but crawler.start-year is not set");
            return;
        }
        int startYear = properties.getStartYear();
        int endYear = properties.getEndYear() == null ? startYear : properties.getEndYear();

        LOGGER.info("Running startup crawl for {}-{}", startYear, endYear);
        UUID runId = crawlJobService.runCrawl(new CrawlRequest(
            startYear,
            endYear,
            properties.getUserAgent(),
            properties.getQuarters(),
            properties.getFilingTypes(),
            properties.isSkipExisting(),
            properties.getPageLimit()
        ));
        crawlJobService.getRun(runId).ifPresent(run -> LOGGER.info(
            "Startup crawl {} ended {}: {} exhibit(s), {} failure(s)",
            runId, run.getStatus(), run.getExhibitsFound(), run.getFailedCount()));
    }
}
