package com.ifip.exhibits.controller;

import com.ifip.exhibits.config.CrawlerProperties;
import com.ifip.exhibits.domain.CrawlFailureEntity;
import com.ifip.exhibits.domain.CrawlRequest;
import com.ifip.exhibits.domain.CrawlRunEntity;
import com.ifip.exhibits.service.CrawlJobService;
import com.ifip.exhibits.service.CrawlProgress;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/crawl")
public class CrawlController {

    private final CrawlJobService crawlJobService;
    private final CrawlerProperties properties;

    public CrawlController(CrawlJobService crawlJobService, CrawlerProperties properties) {
        this.crawlJobService = crawlJobService;
        this.properties = properties;
    }

    @PostMapping("/runs")
    public ResponseEntity<Map<String, Object>> start(@Valid @RequestBody CrawlRunRequest request) {
        UUID runId = crawlJobService.startRun(toCrawlRequest(request));
        return ResponseEntity.accepted().body(Map.of("runId", runId));
    }

    @GetMapping("/runs/{runId}")
    public CrawlRunResponse getRun(@PathVariable UUID runId) {
        CrawlRunEntity run = crawlJobService.getRun(runId)
            .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));

        List<CrawlRunResponse.FailureItem> failures = crawlJobService.getRunFailures(runId)
            .stream()
            .map(this::toFailureItem)
            .toList();

        CrawlRunResponse.ProgressItem progress = null;
        if (run.isActive()) {
            CrawlProgress.Snapshot snapshot = crawlJobService.currentProgress();
            progress = snapshot.isFor(runId) ? toProgressItem(snapshot) : null;
        }

        return new CrawlRunResponse(
            run.getRunId(),
            run.getStatus(),
            run.getStartedAt(),
            run.getCompletedAt(),
            run.getStartYear(),
            run.getEndYear(),
            run.getIndicesAcquired(),
            run.getFilingsMatched(),
            run.getPagesProcessed(),
            run.getPagesSkipped(),
            run.getExhibitsFound(),
            run.getFailedCount(),
            run.getErrorSummary(),
            progress,
            failures
        );
    }

    private CrawlRequest toCrawlRequest(CrawlRunRequest request) {
        return new CrawlRequest(
            request.startYear(),
            request.endYear(),
            request.userAgent() == null || request.userAgent().isBlank() ? properties.getUserAgent() : request.userAgent(),
            request.quarters() == null || request.quarters().isEmpty() ? properties.getQuarters() : request.quarters(),
            request.filingTypes() == null || request.filingTypes().isEmpty() ? properties.getFilingTypes() : request.filingTypes(),
            request.skipExisting() == null ? properties.isSkipExisting() : request.skipExisting(),
            request.pageLimit() == null ? properties.getPageLimit() : request.pageLimit()
        );
    }

    private CrawlRunResponse.ProgressItem toProgressItem(CrawlProgress.Snapshot snapshot) {
        return new CrawlRunResponse.ProgressItem(
            snapshot.stage(),
            snapshot.retryPass(),
            snapshot.pendingRetries(),
            snapshot.updatedAt()
        );
    }

    private CrawlRunResponse.FailureItem toFailureItem(CrawlFailureEntity entity) {
        return new CrawlRunResponse.FailureItem(
            entity.getIndexHtmlUrl(),
            entity.getFailureCode(),
            entity.getFailureReason(),
            entity.getCreatedAt()
        );
    }
}
