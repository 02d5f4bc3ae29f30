package com.ifip.exhibits.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CacheCallTest {

    private static final String URL = "https://www.sec.gov/Archives/edgar/full-index/2023/QTR1/master.zip";

    @Test
    void fingerprintIgnoresUserAgentAndSession() {
        CacheCall first = CacheCall.of("download_index", URL)
            .with(CacheCall.USER_AGENT, "Alpha Research alpha@example.com");
        CacheCall second = CacheCall.of("download_index", URL)
            .with(CacheCall.USER_AGENT, "Beta Labs beta@example.com")
            .with(CacheCall.SESSION, "session-42");

        assertEquals(first.fingerprint(), second.fingerprint());
    }

    @Test
    void fingerprintIsOrderInsensitive() {
        CacheCall forward = CacheCall.of("op", "a", "b").with("x", 1).with("y", 2);
        CacheCall reversed = CacheCall.of("op", "b", "a").with("y", 2).with("x", 1);

        assertEquals(forward.fingerprint(), reversed.fingerprint());
    }

    @Test
    void fingerprintSeparatesOperationsAndArguments() {
        String base = CacheCall.of("crawl_url", URL).fingerprint();

        assertNotEquals(base, CacheCall.of("download_index", URL).fingerprint());
        assertNotEquals(base, CacheCall.of("crawl_url", URL + "?page=2").fingerprint());
        assertNotEquals(base, CacheCall.of("crawl_url", URL).with("limit", 10).fingerprint());
    }

    @Test
    void fingerprintIsLowercaseMd5Hex() {
        String fingerprint = CacheCall.of("crawl_url", URL).fingerprint();

        assertEquals(32, fingerprint.length());
        assertTrue(fingerprint.matches("[0-9a-f]{32}"));
    }
}
