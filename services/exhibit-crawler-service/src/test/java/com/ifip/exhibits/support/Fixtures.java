package com.ifip.exhibits.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ifip.exhibits.config.CrawlerProperties;
import com.ifip.exhibits.domain.ExhibitRecord;
import com.ifip.exhibits.domain.FilingIndexRecord;
import com.ifip.exhibits.domain.FilingMetadata;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

public final class Fixtures {

    public static final String APPLE_PAGE_URL =
        "https://www.sec.gov/Archives/edgar/data/320193/0000320193-23-000106-index.html";

    private static final String MASTER_INDEX_HEADER = String.join("\n",
        "Description:           Master Index of EDGAR Dissemination Feed",
        "Last Data Received:    December 29, 2023",
        "Comments:              webmaster@sec.gov",
        "Anonymous FTP:         ftp://ftp.sec.gov/edgar/",
        "Cloud HTTP:            https://www.sec.gov/Archives/",
        " ",
        " ",
        " ",
        " ",
        "CIK|Company Name|Form Type|Date Filed|Filename",
        "--------------------------------------------------------------------------------"
    ) + "\n";

    private Fixtures() {
    }

    public static CrawlerProperties properties(int maxRetryPasses) {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxRetryPasses(maxRetryPasses);
        properties.setRetryPassDelayMs(0);
        return properties;
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    }

    public static byte[] masterIndexArchive(String... dataLines) {
        StringBuilder text = new StringBuilder(MASTER_INDEX_HEADER);
        for (String line : dataLines) {
            text.append(line).append('\n');
        }
        return zip("master.idx", text.toString().getBytes(StandardCharsets.ISO_8859_1));
    }

    public static byte[] zip(String entryName, byte[] content) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            zip.putNextEntry(new ZipEntry(entryName));
            zip.write(content);
            zip.closeEntry();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    public static byte[] resource(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static FilingIndexRecord appleFiling() {
        return new FilingIndexRecord(
            "320193",
            "Apple Inc.",
            "10-K",
            LocalDate.of(2023, 11, 3),
            "https://www.sec.gov/Archives/edgar/data/320193/0000320193-23-000106.txt",
            APPLE_PAGE_URL
        );
    }

    public static ExhibitRecord exhibit(String pageUrl, String sequence, String documentUrl) {
        return ExhibitRecord.located(
            pageUrl,
            sequence,
            "Exhibit " + sequence,
            documentUrl,
            "EX-10." + sequence,
            "1024",
            "ex10-" + sequence + ".htm",
            LocalDate.of(2023, 9, 30),
            new FilingMetadata("320193", "Apple Inc.", "10-K", LocalDate.of(2023, 11, 3),
                "https://www.sec.gov/Archives/edgar/data/320193/0000320193-23-000106.txt")
        );
    }
}
