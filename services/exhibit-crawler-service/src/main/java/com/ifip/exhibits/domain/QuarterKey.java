package com.ifip.exhibits.domain;

import java.time.LocalDate;

public record QuarterKey(int year, int quarter) {

    public QuarterKey {
        if (quarter < 1 || quarter > 4) {
            throw new IllegalArgumentException("Invalid quarter \"" + quarter + "\"");
        }
    }

    public LocalDate firstDay() {
        return LocalDate.of(year, (quarter - 1) * 3 + 1, 1);
    }

    public String indexUrl(String fullIndexBaseUrl) {
        return fullIndexBaseUrl + "/" + year + "/QTR" + quarter + "/master.zip";
    }

    @Override
    public String toString() {
        return year + "Q" + quarter;
    }
}
