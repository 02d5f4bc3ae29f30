package com.ifip.exhibits.index;

import com.ifip.exhibits.domain.FilingIndexRecord;
import com.ifip.exhibits.domain.QuarterlyIndex;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class IndexFilter {

    public static final String ARCHIVES_BASE_URL = "https://www.sec.gov/Archives/";
    public static final List<String> DEFAULT_FILING_TYPES = List.of("10-K", "10-Q", "8-K");

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexFilter.class);
    private static final int FIELD_COUNT = 5;

    public List<FilingIndexRecord> filter(List<QuarterlyIndex> indices, Collection<String> allowedTypes) {
        Set<String> types = Set.copyOf(allowedTypes == null || allowedTypes.isEmpty() ? DEFAULT_FILING_TYPES : allowedTypes);
        LOGGER.info("Filtering indices for {}", types);

        List<FilingIndexRecord> retained = new ArrayList<>();
        for (QuarterlyIndex index : indices) {
            retained.addAll(filterLines(index.lines(), types));
        }
        return retained;
    }

    public List<FilingIndexRecord> filterLines(List<String> lines, Collection<String> allowedTypes) {
        List<FilingIndexRecord> retained = new ArrayList<>();
        for (String line : lines) {
            parse(line)
                .filter(record -> allowedTypes.contains(record.filingType()))
                .ifPresent(retained::add);
        }
        return retained;
    }

    public Optional<FilingIndexRecord> parse(String line) {
        String[] fields = line.split("\\|", -1);
        if (fields.length != FIELD_COUNT) {
            LOGGER.debug("Skipping malformed index line: {}", line);
            return Optional.empty();
        }

        LocalDate filingDate;
        try {
            filingDate = LocalDate.parse(fields[3].trim());
        } catch (DateTimeParseException e) {
            LOGGER.debug("Skipping index line with bad date: {}", line);
            return Optional.empty();
        }

        String path = fields[4].trim();
        return Optional.of(new FilingIndexRecord(
            fields[0].trim(),
            fields[1].trim(),
            fields[2].trim(),
            filingDate,
            ARCHIVES_BASE_URL + path,
            ARCHIVES_BASE_URL + htmlIndexPath(path)
        ));
    }

    static String htmlIndexPath(String textPath) {
        String stem = textPath.endsWith(".txt") ? textPath.substring(0, textPath.length() - 4) : textPath;
        return stem + "-index.html";
    }
}
