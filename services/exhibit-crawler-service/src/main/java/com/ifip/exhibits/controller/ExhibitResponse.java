package com.ifip.exhibits.controller;

import com.ifip.exhibits.domain.ExhibitRecord;
import com.ifip.exhibits.domain.FilingMetadata;
import java.time.LocalDate;

public record ExhibitResponse(
    String indexHtmlUrl,
    String sequence,
    String description,
    String documentUrl,
    String documentType,
    String sizeText,
    String filename,
    LocalDate reportDate,
    FilingMetadata filingMetadata,
    int contentLength
) {
    public static ExhibitResponse from(ExhibitRecord record) {
        return new ExhibitResponse(
            record.getIndexHtmlUrl(),
            record.getSequence(),
            record.getDescription(),
            record.getDocumentUrl(),
            record.getDocumentType(),
            record.getSizeText(),
            record.getFilename(),
            record.getReportDate(),
            record.getFilingMetadata(),
            record.hasContent() ? record.getContent().length : 0
        );
    }
}
