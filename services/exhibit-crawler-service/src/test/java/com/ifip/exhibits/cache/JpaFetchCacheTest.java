package com.ifip.exhibits.cache;

import com.ifip.exhibits.repository.FetchCacheEntryRepository;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import(JpaFetchCache.class)
class JpaFetchCacheTest {

    @Autowired
    private JpaFetchCache fetchCache;

    @Autowired
    private FetchCacheEntryRepository repository;

    @Test
    void storesAndReadsPayloadByFingerprint() {
        String fingerprint = CacheCall.of("crawl_url", "https://www.sec.gov/a.htm").fingerprint();

        fetchCache.put(fingerprint, "crawl_url", "payload".getBytes(StandardCharsets.UTF_8));

        assertArrayEquals("payload".getBytes(StandardCharsets.UTF_8), fetchCache.get(fingerprint).orElseThrow());
        assertEquals(1, repository.countByOperation("crawl_url"));
    }

    @Test
    void putOverwritesExistingEntry() {
        String fingerprint = CacheCall.of("download_index", "https://www.sec.gov/master.zip").fingerprint();

        fetchCache.put(fingerprint, "download_index", new byte[] {1, 2, 3});
        fetchCache.put(fingerprint, "download_index", new byte[] {4, 5});

        assertArrayEquals(new byte[] {4, 5}, fetchCache.get(fingerprint).orElseThrow());
        assertEquals(1, repository.count());
    }

    @Test
    void missingFingerprintIsEmpty() {
        assertTrue(fetchCache.get("0123456789abcdef0123456789abcdef").isEmpty());
    }
}
