package com.ifip.exhibits.controller;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record CrawlRunRequest(
    @NotNull(message = "is required")
    @Min(1993)
    Integer startYear,

    @NotNull(message = "is required")
    @Min(1993)
    Integer endYear,

    String userAgent,

    List<@Min(1) @Max(4) Integer> quarters,

    List<String> filingTypes,

    Boolean skipExisting,

    @Min(0)
    Integer pageLimit
) {
}
