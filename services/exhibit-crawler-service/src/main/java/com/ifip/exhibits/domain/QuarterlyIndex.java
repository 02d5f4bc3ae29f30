package com.ifip.exhibits.domain;

import java.util.List;

public record QuarterlyIndex(QuarterKey key, List<String> lines) {

    public QuarterlyIndex {
        lines = List.copyOf(lines);
    }
}
