package com.ifip.exhibits.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;

@JsonPropertyOrder({
    "index_html_url", "seq", "desc", "doc_link", "doc_type", "size", "filename",
    "report_date", "filing_metadata", "doc_content"
})
public class ExhibitRecord {

    @JsonProperty("index_html_url")
    private String indexHtmlUrl;

    @JsonProperty("seq")
    private String sequence;

    @JsonProperty("desc")
    private String description;

    @JsonProperty("doc_link")
    private String documentUrl;

    @JsonProperty("doc_type")
    private String documentType;

    @JsonProperty("size")
    private String sizeText;

    @JsonProperty("filename")
    private String filename;

    @JsonProperty("report_date")
    private LocalDate reportDate;

    @JsonProperty("filing_metadata")
    private FilingMetadata filingMetadata;

    @JsonProperty("doc_content")
    private byte[] content;

    private ExhibitRecord() {
    }

    public static ExhibitRecord located(
        String indexHtmlUrl,
        String sequence,
        String description,
        String documentUrl,
        String documentType,
        String sizeText,
        String filename,
        LocalDate reportDate,
        FilingMetadata filingMetadata
    ) {
        ExhibitRecord record = new ExhibitRecord();
        record.indexHtmlUrl = indexHtmlUrl;
        record.sequence = sequence;
        record.description = description;
        record.documentUrl = documentUrl;
        record.documentType = documentType;
        record.sizeText = sizeText;
        record.filename = filename;
        record.reportDate = reportDate;
        record.filingMetadata = filingMetadata;
        return record;
    }

    public boolean fillContent(byte[] downloaded) {
        if (content == null && downloaded != null) {
            content = downloaded;
        }
        return hasContent();
    }

    @JsonIgnore
    public boolean hasContent() {
        return content != null;
    }

    public String getIndexHtmlUrl() {
        return indexHtmlUrl;
    }

    public String getSequence() {
        return sequence;
    }

    public String getDescription() {
        return description;
    }

    public String getDocumentUrl() {
        return documentUrl;
    }

    public String getDocumentType() {
        return documentType;
    }

    public String getSizeText() {
        return sizeText;
    }

    public String getFilename() {
        return filename;
    }

    public LocalDate getReportDate() {
        return reportDate;
    }

    public FilingMetadata getFilingMetadata() {
        return filingMetadata;
    }

    public byte[] getContent() {
        return content;
    }
}
