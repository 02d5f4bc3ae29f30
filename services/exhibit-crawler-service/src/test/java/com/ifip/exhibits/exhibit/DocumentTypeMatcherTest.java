package com.ifip.exhibits.exhibit;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentTypeMatcherTest {

    private final DocumentTypeMatcher matcher = new DocumentTypeMatcher(List.of("EX-10"));

    @Test
    void matchesBaseTagAndDottedSubtypes() {
        assertTrue(matcher.test("EX-10"));
        assertTrue(matcher.test("EX-10.1"));
        assertTrue(matcher.test("EX-10.99"));
        assertTrue(matcher.test(" ex-10.2 "));
    }

    @Test
    void rejectsOtherExhibitFamilies() {
        assertFalse(matcher.test("EX-101"));
        assertFalse(matcher.test("EX-101.SCH"));
        assertFalse(matcher.test("EX-2"));
        assertFalse(matcher.test("10-K"));
        assertFalse(matcher.test(""));
        assertFalse(matcher.test(null));
    }

    @Test
    void supportsSeveralTags() {
        DocumentTypeMatcher contractsAndIndentures = new DocumentTypeMatcher(List.of("EX-10", "ex-4"));

        assertTrue(contractsAndIndentures.test("EX-4.1"));
        assertTrue(contractsAndIndentures.test("EX-10.3"));
        assertFalse(contractsAndIndentures.test("EX-21"));
    }

    @Test
    void requiresAtLeastOneTag() {
        assertThrows(IllegalArgumentException.class, () -> new DocumentTypeMatcher(List.of()));
    }
}
