package com.ifip.exhibits.exhibit;

import com.ifip.exhibits.cache.CachedFetchService;
import com.ifip.exhibits.client.ExhibitBatchStorage;
import com.ifip.exhibits.domain.ExhibitRecord;
import com.ifip.exhibits.domain.LocatedPage;
import com.ifip.exhibits.service.CrawlProgress;
import com.ifip.exhibits.service.RetryLoop;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ExhibitDownloader {

    public static final String STAGE = "DOWNLOADING_EXHIBITS";

    private static final Logger LOGGER = LoggerFactory.getLogger(ExhibitDownloader.class);

    private final CachedFetchService cachedFetchService;
    private final ExhibitBatchStorage batchStorage;
    private final RetryLoop retryLoop;
    private final CrawlProgress progress;

    public ExhibitDownloader(
        CachedFetchService cachedFetchService,
        ExhibitBatchStorage batchStorage,
        RetryLoop retryLoop,
        CrawlProgress progress
    ) {
        this.cachedFetchService = cachedFetchService;
        this.batchStorage = batchStorage;
        this.retryLoop = retryLoop;
        this.progress = progress;
    }

    public List<ExhibitRecord> download(LocatedPage page, String userAgent, boolean skipExisting) {
        if (page.isEmpty()) {
            return List.of();
        }

        String pageKey = page.pageKey();
        if (skipExisting && batchStorage.exists(pageKey)) {
            List<ExhibitRecord> stored = batchStorage.read(pageKey);
            if (!stored.isEmpty() && stored.stream().allMatch(ExhibitRecord::hasContent)) {
                LOGGER.debug("Reusing batch {} for {}", pageKey, page.indexHtmlUrl());
                return stored;
            }
            LOGGER.warn("Batch {} for {} is incomplete, downloading again", pageKey, page.indexHtmlUrl());
        }

        progress.enterStage(STAGE);
        List<ExhibitRecord> records = page.exhibits();
        List<ExhibitRecord> missing = new ArrayList<>();
        for (ExhibitRecord record : records) {
            if (!record.hasContent() && !fetchInto(record, userAgent)) {
                missing.add(record);
            }
        }

        retryLoop.run("exhibits of " + page.indexHtmlUrl(), missing, record -> fetchInto(record, userAgent));

        String location = batchStorage.write(pageKey, records);
        LOGGER.debug("Wrote {} exhibit(s) of {} to {}", records.size(), page.indexHtmlUrl(), location);
        return records;
    }

    private boolean fetchInto(ExhibitRecord record, String userAgent) {
        return cachedFetchService.fetch(record.getDocumentUrl(), userAgent)
            .map(record::fillContent)
            .orElse(false);
    }
}
