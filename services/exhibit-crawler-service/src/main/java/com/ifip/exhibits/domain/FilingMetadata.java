package com.ifip.exhibits.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;

@JsonPropertyOrder({"cik", "name", "type", "date", "index_text_url"})
public record FilingMetadata(
    @JsonProperty("cik") String cik,
    @JsonProperty("name") String companyName,
    @JsonProperty("type") String filingType,
    @JsonProperty("date") LocalDate filingDate,
    @JsonProperty("index_text_url") String indexTextUrl
) {
}
