package com.ifip.exhibits.exhibit;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

// EX-10 accepts EX-10 and EX-10.1, never EX-101.
public class DocumentTypeMatcher implements Predicate<String> {

    private final List<String> baseTags;

    public DocumentTypeMatcher(Collection<String> baseTags) {
        if (baseTags == null || baseTags.isEmpty()) {
            throw new IllegalArgumentException("At least one exhibit type is required");
        }
        this.baseTags = baseTags.stream()
            .map(tag -> tag.trim().toUpperCase(Locale.ROOT))
            .toList();
    }

    @Override
    public boolean test(String documentType) {
        if (documentType == null) {
            return false;
        }
        String type = documentType.trim().toUpperCase(Locale.ROOT);
        for (String tag : baseTags) {
            if (type.equals(tag) || type.startsWith(tag + ".")) {
                return true;
            }
        }
        return false;
    }
}
