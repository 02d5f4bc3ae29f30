package com.ifip.exhibits.domain;

import com.ifip.exhibits.support.Fixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExhibitRecordTest {

    @Test
    void contentIsFilledOnlyOnce() {
        ExhibitRecord record = Fixtures.exhibit(Fixtures.APPLE_PAGE_URL, "1", "https://www.sec.gov/a.htm");

        assertFalse(record.fillContent(null));
        assertTrue(record.fillContent(new byte[] {1}));
        assertTrue(record.fillContent(new byte[] {2}));
        assertArrayEquals(new byte[] {1}, record.getContent());
    }
}
