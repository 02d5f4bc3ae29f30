package com.ifip.exhibits.cache;

import com.ifip.exhibits.support.InMemoryFetchCache;
import com.ifip.exhibits.support.ScriptedFetcher;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CachedFetchServiceTest {

    private static final String URL = "https://www.sec.gov/Archives/edgar/data/320193/a10-1.htm";

    private ScriptedFetcher fetcher;
    private InMemoryFetchCache cache;
    private CachedFetchService service;

    @BeforeEach
    void setUp() {
        fetcher = new ScriptedFetcher();
        cache = new InMemoryFetchCache();
        service = new CachedFetchService(cache, fetcher);
    }

    @Test
    void secondFetchWithAnotherUserAgentIsServedFromCache() {
        fetcher.respond(URL, bytes("agreement"));

        Optional<byte[]> first = service.fetch(URL, "Alpha alpha@example.com");
        Optional<byte[]> second = service.fetch(URL, "Beta beta@example.com");

        assertArrayEquals(bytes("agreement"), first.orElseThrow());
        assertArrayEquals(bytes("agreement"), second.orElseThrow());
        assertEquals(1, fetcher.callsTo(URL));
        assertEquals(1, cache.countOperation(CachedFetchService.CRAWL_URL));
    }

    @Test
    void failuresAreNotCached() {
        fetcher.failFirst(URL, 1).respond(URL, bytes("agreement"));

        assertTrue(service.fetch(URL, "ua").isEmpty());
        assertEquals(0, cache.size());

        assertArrayEquals(bytes("agreement"), service.fetch(URL, "ua").orElseThrow());
        assertEquals(2, fetcher.callsTo(URL));
        assertEquals(1, cache.size());
    }

    @Test
    void cachedDoesNotComputeOnHit() {
        CacheCall call = CacheCall.of("download_index", URL);
        AtomicInteger computations = new AtomicInteger();

        service.cached(call, () -> {
            computations.incrementAndGet();
            return Optional.of(bytes("v1"));
        });
        Optional<byte[]> hit = service.cached(call, () -> {
            computations.incrementAndGet();
            return Optional.of(bytes("v2"));
        });

        assertEquals(1, computations.get());
        assertArrayEquals(bytes("v1"), hit.orElseThrow());
    }

    @Test
    void forcedRecomputesAndOverwrites() {
        CacheCall call = CacheCall.of("download_index", URL);
        service.cached(call, () -> Optional.of(bytes("stale")));

        Optional<byte[]> refreshed = service.forced(call, () -> Optional.of(bytes("fresh")));

        assertArrayEquals(bytes("fresh"), refreshed.orElseThrow());
        assertArrayEquals(bytes("fresh"), cache.get(call.fingerprint()).orElseThrow());
        assertEquals(1, cache.size());
    }

    @Test
    void forcedFailureKeepsPreviousEntry() {
        CacheCall call = CacheCall.of("download_index", URL);
        service.cached(call, () -> Optional.of(bytes("kept")));

        assertTrue(service.forced(call, Optional::empty).isEmpty());
        assertArrayEquals(bytes("kept"), cache.get(call.fingerprint()).orElseThrow());
    }

    @Test
    void fetchUncachedBypassesCache() {
        fetcher.respond(URL, bytes("agreement"));

        service.fetchUncached(URL, "ua");
        service.fetchUncached(URL, "ua");

        assertEquals(2, fetcher.callsTo(URL));
        assertEquals(0, cache.size());
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
