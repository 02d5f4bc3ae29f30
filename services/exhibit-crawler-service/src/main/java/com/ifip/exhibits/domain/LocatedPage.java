package com.ifip.exhibits.domain;

import java.util.List;

public record LocatedPage(
    String indexHtmlUrl,
    String pageKey,
    List<ExhibitRecord> exhibits
) {
    public boolean isEmpty() {
        return exhibits.isEmpty();
    }
}
