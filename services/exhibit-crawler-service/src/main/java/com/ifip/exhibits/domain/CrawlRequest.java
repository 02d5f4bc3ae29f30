package com.ifip.exhibits.domain;

import java.util.List;

public record CrawlRequest(
    int startYear,
    int endYear,
    String userAgent,
    List<Integer> quarters,
    List<String> filingTypes,
    boolean skipExisting,
    int pageLimit
) {
    public CrawlRequest {
        quarters = List.copyOf(quarters);
        filingTypes = List.copyOf(filingTypes);
    }
}
