package com.ifip.exhibits.cache;

import com.ifip.exhibits.client.DocumentFetcher;
import com.ifip.exhibits.client.FetchResult;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CachedFetchService {

    public static final String CRAWL_URL = "crawl_url";

    private static final Logger LOGGER = LoggerFactory.getLogger(CachedFetchService.class);

    private final FetchCache fetchCache;
    private final DocumentFetcher documentFetcher;

    public CachedFetchService(FetchCache fetchCache, DocumentFetcher documentFetcher) {
        this.fetchCache = fetchCache;
        this.documentFetcher = documentFetcher;
    }

    public Optional<byte[]> cached(CacheCall call, Supplier<Optional<byte[]>> compute) {
        String fingerprint = call.fingerprint();
        Optional<byte[]> hit = fetchCache.get(fingerprint);
        if (hit.isPresent()) {
            LOGGER.trace("Cache hit for {} {}", call.operation(), fingerprint);
            return hit;
        }
        return computeAndStore(call, fingerprint, compute);
    }

    public Optional<byte[]> forced(CacheCall call, Supplier<Optional<byte[]>> compute) {
        return computeAndStore(call, call.fingerprint(), compute);
    }

    public Optional<byte[]> fetch(String url, String userAgent) {
        return cached(crawlCall(url, userAgent), () -> fetchUncached(url, userAgent));
    }

    public Optional<byte[]> fetchUncached(String url, String userAgent) {
        FetchResult result = documentFetcher.fetch(url, userAgent);
        if (!result.isSuccessful()) {
            LOGGER.debug("Fetch of {} failed ({}): {}", url, result.statusCode(), result.failureReason());
        }
        return result.content();
    }

    static CacheCall crawlCall(String url, String userAgent) {
        return CacheCall.of(CRAWL_URL, url).with(CacheCall.USER_AGENT, userAgent);
    }

    private Optional<byte[]> computeAndStore(CacheCall call, String fingerprint, Supplier<Optional<byte[]>> compute) {
        Optional<byte[]> computed = compute.get();
        computed.ifPresent(payload -> fetchCache.put(fingerprint, call.operation(), payload));
        return computed;
    }
}
