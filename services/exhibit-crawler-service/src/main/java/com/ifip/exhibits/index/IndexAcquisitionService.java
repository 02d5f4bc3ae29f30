package com.ifip.exhibits.index;

import com.ifip.exhibits.cache.CacheCall;
import com.ifip.exhibits.cache.CachedFetchService;
import com.ifip.exhibits.domain.QuarterKey;
import com.ifip.exhibits.domain.QuarterlyIndex;
import com.ifip.exhibits.service.CrawlProgress;
import com.ifip.exhibits.service.RetryLoop;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class IndexAcquisitionService {

    public static final String FULL_INDEX_BASE_URL = "https://www.sec.gov/Archives/edgar/full-index";
    public static final String STAGE = "ACQUIRING_INDICES";

    static final String DOWNLOAD_INDEX = "download_index";

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexAcquisitionService.class);
    private static final List<Integer> ALL_QUARTERS = List.of(1, 2, 3, 4);

    private final CachedFetchService cachedFetchService;
    private final RetryLoop retryLoop;
    private final CrawlProgress progress;
    private final Clock clock;

    public IndexAcquisitionService(
        CachedFetchService cachedFetchService,
        RetryLoop retryLoop,
        CrawlProgress progress,
        Clock clock
    ) {
        this.cachedFetchService = cachedFetchService;
        this.retryLoop = retryLoop;
        this.progress = progress;
        this.clock = clock;
    }

    public List<QuarterlyIndex> acquireIndices(int startYear, int endYear, String userAgent, List<Integer> quarters) {
        List<QuarterKey> periods = elapsedPeriods(startYear, endYear, quarters);
        progress.enterStage(STAGE);

        Map<QuarterKey, QuarterlyIndex> acquired = new HashMap<>();
        List<QuarterKey> failed = new ArrayList<>();
        for (QuarterKey key : periods) {
            acquire(key, userAgent, false).ifPresentOrElse(
                index -> acquired.put(key, index),
                () -> failed.add(key)
            );
        }

        retryLoop.run(STAGE, failed, key -> acquire(key, userAgent, true)
            .map(index -> {
                acquired.put(key, index);
                return true;
            })
            .orElse(false));

        return periods.stream().map(acquired::get).toList();
    }

    List<QuarterKey> elapsedPeriods(int startYear, int endYear, List<Integer> quarters) {
        if (startYear > endYear) {
            throw new IllegalArgumentException("startYear " + startYear + " is after endYear " + endYear);
        }
        List<Integer> selected = quarters == null || quarters.isEmpty() ? ALL_QUARTERS : quarters;
        for (Integer quarter : selected) {
            if (quarter == null || quarter < 1 || quarter > 4) {
                throw new IllegalArgumentException("Invalid quarter \"" + quarter + "\"");
            }
        }

        LocalDate today = LocalDate.now(clock);
        List<QuarterKey> periods = new ArrayList<>();
        for (int year = startYear; year <= endYear; year++) {
            for (int quarter : selected) {
                QuarterKey key = new QuarterKey(year, quarter);
                if (key.firstDay().isAfter(today)) {
                    LOGGER.debug("Skipping {}: quarter has not started", key);
                    continue;
                }
                periods.add(key);
            }
        }
        return periods;
    }

    private Optional<QuarterlyIndex> acquire(QuarterKey key, String userAgent, boolean force) {
        String url = key.indexUrl(FULL_INDEX_BASE_URL);
        CacheCall call = CacheCall.of(DOWNLOAD_INDEX, url).with(CacheCall.USER_AGENT, userAgent);
        Supplier<Optional<byte[]>> compute = () -> downloadArchive(url, userAgent);

        Optional<byte[]> archive = force
            ? cachedFetchService.forced(call, compute)
            : cachedFetchService.cached(call, compute);
        return archive.map(bytes -> new QuarterlyIndex(key, MasterIndexArchive.readDataLines(bytes)));
    }

    private Optional<byte[]> downloadArchive(String url, String userAgent) {
        LOGGER.info("Downloading {}", url);
        Optional<byte[]> archive = cachedFetchService.fetchUncached(url, userAgent);
        if (archive.isPresent() && !MasterIndexArchive.isIndexArchive(archive.get())) {
            LOGGER.warn("Discarding {}: payload is not a master index archive", url);
            return Optional.empty();
        }
        return archive;
    }
}
