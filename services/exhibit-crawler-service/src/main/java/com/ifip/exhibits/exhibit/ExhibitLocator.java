package com.ifip.exhibits.exhibit;

import com.ifip.exhibits.cache.CachedFetchService;
import com.ifip.exhibits.domain.ExhibitRecord;
import com.ifip.exhibits.domain.FilingIndexRecord;
import com.ifip.exhibits.domain.FilingMetadata;
import com.ifip.exhibits.domain.LocatedPage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

@Component
public class ExhibitLocator {

    public static final String DOCUMENT_TABLE_SUMMARY = "Document Format Files";

    private static final Logger LOGGER = LoggerFactory.getLogger(ExhibitLocator.class);
    private static final String PERIOD_OF_REPORT = "Period of Report";
    private static final String INLINE_VIEWER_PATH = "/ix";
    private static final String INLINE_VIEWER_PARAM = "doc=";
    private static final int CELL_COUNT = 5;

    private final CachedFetchService cachedFetchService;
    private final DocumentTypeMatcher documentTypeMatcher;

    public ExhibitLocator(CachedFetchService cachedFetchService, DocumentTypeMatcher documentTypeMatcher) {
        this.cachedFetchService = cachedFetchService;
        this.documentTypeMatcher = documentTypeMatcher;
    }

    public static String pageKey(String indexHtmlUrl) {
        return DigestUtils.md5DigestAsHex(indexHtmlUrl.getBytes(StandardCharsets.UTF_8));
    }

    public LocatedPage locate(FilingIndexRecord filing, String userAgent) {
        Optional<byte[]> html = cachedFetchService.fetch(filing.indexHtmlUrl(), userAgent);
        if (html.isEmpty()) {
            LOGGER.warn("Skipping {}: filing index page could not be fetched", filing.indexHtmlUrl());
            return emptyPage(filing.indexHtmlUrl());
        }
        return parse(filing, html.get());
    }

    public LocatedPage parse(FilingIndexRecord filing, byte[] html) {
        String pageUrl = filing.indexHtmlUrl();
        Document document = parseDocument(html, pageUrl);

        Element table = document.select("table.tableFile").stream()
            .filter(candidate -> DOCUMENT_TABLE_SUMMARY.equals(candidate.attr("summary")))
            .findFirst()
            .orElse(null);
        if (table == null) {
            LOGGER.info("Skipping {}: no document table", pageUrl);
            return emptyPage(pageUrl);
        }

        LocalDate reportDate = reportDate(document);
        FilingMetadata metadata = filing.metadata();
        Elements rows = table.select("tr");
        List<ExhibitRecord> exhibits = new ArrayList<>();
        for (Element row : rows.subList(Math.min(1, rows.size()), rows.size())) {
            Elements cells = row.getElementsByTag("td");
            if (cells.size() != CELL_COUNT) {
                LOGGER.debug("Dropping row with {} cells on {}", cells.size(), pageUrl);
                continue;
            }

            String documentType = cells.get(3).text().trim().toUpperCase(Locale.ROOT);
            if (!documentTypeMatcher.test(documentType)) {
                continue;
            }

            Element anchor = cells.get(2).selectFirst("a[href]");
            if (anchor == null) {
                LOGGER.debug("Dropping {} row without a link on {}", documentType, pageUrl);
                continue;
            }

            exhibits.add(ExhibitRecord.located(
                pageUrl,
                cells.get(0).text(),
                cells.get(1).text(),
                documentUrl(anchor),
                documentType,
                cells.get(4).text(),
                anchor.text(),
                reportDate,
                metadata
            ));
        }
        return new LocatedPage(pageUrl, pageKey(pageUrl), List.copyOf(exhibits));
    }

    // Inline XBRL documents are linked through the viewer; the document itself is its doc parameter.
    static String documentUrl(Element anchor) {
        String absolute = anchor.absUrl("href");
        if (absolute.isEmpty()) {
            absolute = anchor.attr("href");
        }
        URI uri;
        try {
            uri = URI.create(absolute);
        } catch (IllegalArgumentException e) {
            return absolute;
        }
        String query = uri.getRawQuery();
        if (INLINE_VIEWER_PATH.equals(uri.getPath()) && query != null && query.startsWith(INLINE_VIEWER_PARAM)) {
            return uri.resolve(query.substring(INLINE_VIEWER_PARAM.length())).toString();
        }
        return absolute;
    }

    private LocalDate reportDate(Document document) {
        for (Element head : document.select("div.infoHead")) {
            if (!PERIOD_OF_REPORT.equalsIgnoreCase(head.text())) {
                continue;
            }
            Element value = head.nextElementSibling();
            if (value == null || !value.hasClass("info")) {
                return null;
            }
            try {
                return LocalDate.parse(value.text().trim());
            } catch (DateTimeParseException e) {
                LOGGER.debug("Unparseable period of report '{}'", value.text());
                return null;
            }
        }
        return null;
    }

    private Document parseDocument(byte[] html, String pageUrl) {
        try {
            return Jsoup.parse(new ByteArrayInputStream(html), null, pageUrl);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse filing index page " + pageUrl, e);
        }
    }

    private LocatedPage emptyPage(String pageUrl) {
        return new LocatedPage(pageUrl, pageKey(pageUrl), List.of());
    }
}
