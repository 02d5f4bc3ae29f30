package com.ifip.exhibits.service;

import com.ifip.exhibits.domain.CrawlFailureEntity;
import com.ifip.exhibits.domain.CrawlRequest;
import com.ifip.exhibits.domain.CrawlRunEntity;
import com.ifip.exhibits.domain.ExhibitRecord;
import com.ifip.exhibits.domain.FilingIndexRecord;
import com.ifip.exhibits.domain.LocatedPage;
import com.ifip.exhibits.domain.QuarterlyIndex;
import com.ifip.exhibits.exhibit.ExhibitDownloader;
import com.ifip.exhibits.exhibit.ExhibitLocator;
import com.ifip.exhibits.index.IndexAcquisitionService;
import com.ifip.exhibits.index.IndexFilter;
import com.ifip.exhibits.repository.CrawlFailureRepository;
import com.ifip.exhibits.repository.CrawlRunRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

@Service
public class CrawlJobService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CrawlJobService.class);

    private final IndexAcquisitionService indexAcquisitionService;
    private final IndexFilter indexFilter;
    private final ExhibitLocator exhibitLocator;
    private final ExhibitDownloader exhibitDownloader;
    private final CrawlRunRepository crawlRunRepository;
    private final CrawlFailureRepository crawlFailureRepository;
    private final CrawlProgress progress;
    private final TaskExecutor crawlTaskExecutor;

    public CrawlJobService(
        IndexAcquisitionService indexAcquisitionService,
        IndexFilter indexFilter,
        ExhibitLocator exhibitLocator,
        ExhibitDownloader exhibitDownloader,
        CrawlRunRepository crawlRunRepository,
        CrawlFailureRepository crawlFailureRepository,
        CrawlProgress progress,
        @Qualifier("crawlTaskExecutor") TaskExecutor crawlTaskExecutor
    ) {
        this.indexAcquisitionService = indexAcquisitionService;
        this.indexFilter = indexFilter;
        this.exhibitLocator = exhibitLocator;
        this.exhibitDownloader = exhibitDownloader;
        this.crawlRunRepository = crawlRunRepository;
        this.crawlFailureRepository = crawlFailureRepository;
        this.progress = progress;
        this.crawlTaskExecutor = crawlTaskExecutor;
    }

    public UUID startRun(CrawlRequest request) {
        validate(request);
        CrawlRunEntity run = crawlRunRepository.save(CrawlRunEntity.startNew(request.startYear(), request.endYear()));
        try {
            crawlTaskExecutor.execute(() -> execute(run, request));
        } catch (TaskRejectedException rejected) {
            LOGGER.warn("Crawl {} rejected: crawl queue is full", run.getRunId());
            run.fail("crawl queue is full");
            crawlRunRepository.save(run);
            throw rejected;
        }
        return run.getRunId();
    }

    public UUID runCrawl(CrawlRequest request) {
        validate(request);
        CrawlRunEntity run = crawlRunRepository.save(CrawlRunEntity.startNew(request.startYear(), request.endYear()));
        execute(run, request);
        return run.getRunId();
    }

    public Optional<CrawlRunEntity> getRun(UUID runId) {
        return crawlRunRepository.findById(runId);
    }

    public List<CrawlFailureEntity> getRunFailures(UUID runId) {
        return crawlFailureRepository.findTop20ByRunIdOrderByCreatedAtDesc(runId);
    }

    public CrawlProgress.Snapshot currentProgress() {
        return progress.snapshot();
    }

    void execute(CrawlRunEntity run, CrawlRequest request) {
        LOGGER.info("Starting crawl {} for {}-{} quarters {}",
            run.getRunId(), request.startYear(), request.endYear(), request.quarters());
        try {
            progress.start(run.getRunId());
            run.markRunning();
            crawlRunRepository.save(run);

            List<QuarterlyIndex> indices = indexAcquisitionService.acquireIndices(
                request.startYear(),
                request.endYear(),
                request.userAgent(),
                request.quarters()
            );
            List<FilingIndexRecord> filings = indexFilter.filter(indices, request.filingTypes());
            run.recordIndices(indices.size(), filings.size());
            crawlRunRepository.save(run);

            List<FilingIndexRecord> pages = request.pageLimit() > 0 && filings.size() > request.pageLimit()
                ? filings.subList(0, request.pageLimit())
                : filings;
            LOGGER.info("Crawling {} of {} matching filing(s)", pages.size(), filings.size());
            for (FilingIndexRecord filing : pages) {
                crawlPage(run, filing, request);
                crawlRunRepository.save(run);
            }

            run.complete();
            crawlRunRepository.save(run);
            LOGGER.info("Crawl {} finished with {} exhibit(s) from {} page(s)",
                run.getRunId(), run.getExhibitsFound(), run.getPagesProcessed());
        } catch (RetryStalledException stalled) {
            LOGGER.error("Crawl {} stalled: {}", run.getRunId(), stalled.getMessage());
            run.stall(truncate(stalled.getMessage(), 400));
            crawlRunRepository.save(run);
        } catch (RuntimeException fatal) {
            LOGGER.error("Crawl {} failed", run.getRunId(), fatal);
            run.fail(truncate(fatal.getMessage(), 400));
            crawlRunRepository.save(run);
            throw fatal;
        } finally {
            progress.reset();
        }
    }

    private void crawlPage(CrawlRunEntity run, FilingIndexRecord filing, CrawlRequest request) {
        try {
            LocatedPage page = exhibitLocator.locate(filing, request.userAgent());
            if (page.isEmpty()) {
                run.incrementSkipped();
                return;
            }

            List<ExhibitRecord> results = exhibitDownloader.download(page, request.userAgent(), request.skipExisting());
            int retrieved = (int) results.stream().filter(ExhibitRecord::hasContent).count();
            run.recordPage(retrieved);
            LOGGER.info("Found {} exhibits", run.getExhibitsFound());
        } catch (RetryStalledException stalled) {
            LOGGER.error("Giving up on {} for this run: {}", filing.indexHtmlUrl(), stalled.getMessage());
            recordFailure(run, filing, "DOWNLOAD_STALLED", stalled);
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to crawl {}", filing.indexHtmlUrl(), ex);
            recordFailure(run, filing, "PROCESSING_ERROR", ex);
        }
    }

    private void recordFailure(CrawlRunEntity run, FilingIndexRecord filing, String code, Exception ex) {
        run.incrementFailed();
        crawlFailureRepository.save(CrawlFailureEntity.of(
            run.getRunId(),
            filing.indexHtmlUrl(),
            code,
            truncate(ex.getMessage(), 400)
        ));
    }

    private void validate(CrawlRequest request) {
        if (request.startYear() > request.endYear()) {
            throw new IllegalArgumentException(
                "startYear " + request.startYear() + " is after endYear " + request.endYear());
        }
        if (request.userAgent() == null || request.userAgent().isBlank()) {
            throw new IllegalArgumentException("userAgent must not be blank");
        }
        for (Integer quarter : request.quarters()) {
            if (quarter == null || quarter < 1 || quarter > 4) {
                throw new IllegalArgumentException("Invalid quarter \"" + quarter + "\"");
            }
        }
    }

    private String truncate(String text, int max) {
        if (text == null || text.isBlank()) {
            return "unknown";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
