package com.ifip.exhibits.index;

import com.ifip.exhibits.support.Fixtures;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MasterIndexArchiveTest {

    @Test
    void dropsHeaderAndBlankLines() {
        byte[] archive = Fixtures.masterIndexArchive(
            "1000045|NICHOLAS FINANCIAL INC|10-Q|2023-02-14|edgar/data/1000045/0000950170-23-002966.txt",
            "",
            "   ",
            "  320193|Apple Inc.|10-K|2023-11-03|edgar/data/320193/0000320193-23-000106.txt  "
        );

        List<String> lines = MasterIndexArchive.readDataLines(archive);

        assertEquals(List.of(
            "1000045|NICHOLAS FINANCIAL INC|10-Q|2023-02-14|edgar/data/1000045/0000950170-23-002966.txt",
            "320193|Apple Inc.|10-K|2023-11-03|edgar/data/320193/0000320193-23-000106.txt"
        ), lines);
    }

    @Test
    void decodesLatin1CompanyNames() {
        byte[] archive = Fixtures.masterIndexArchive("1234|Société Générale|8-K|2023-03-01|edgar/data/1234/x.txt");

        assertEquals("1234|Société Générale|8-K|2023-03-01|edgar/data/1234/x.txt",
            MasterIndexArchive.readDataLines(archive).get(0));
    }

    @Test
    void recognisesOnlyArchivesHoldingTheIndex() {
        assertTrue(MasterIndexArchive.isIndexArchive(Fixtures.masterIndexArchive()));
        assertFalse(MasterIndexArchive.isIndexArchive(Fixtures.zip("readme.txt", new byte[] {1})));
        assertFalse(MasterIndexArchive.isIndexArchive("<html>Request Rate Threshold Exceeded</html>"
            .getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void rejectsArchiveWithoutIndexEntry() {
        byte[] archive = Fixtures.zip("company.idx", "x".getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalArgumentException.class, () -> MasterIndexArchive.readDataLines(archive));
    }
}
