package com.ifip.exhibits.domain;

import java.time.LocalDate;

public record FilingIndexRecord(
    String cik,
    String companyName,
    String filingType,
    LocalDate filingDate,
    String indexTextUrl,
    String indexHtmlUrl
) {
    public FilingMetadata metadata() {
        return new FilingMetadata(cik, companyName, filingType, filingDate, indexTextUrl);
    }
}
