package com.ifip.exhibits.domain;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QuarterKeyTest {

    @Test
    void buildsIndexUrlAndFirstDay() {
        QuarterKey key = new QuarterKey(2023, 3);

        assertEquals("https://www.sec.gov/Archives/edgar/full-index/2023/QTR3/master.zip",
            key.indexUrl("https://www.sec.gov/Archives/edgar/full-index"));
        assertEquals(LocalDate.of(2023, 7, 1), key.firstDay());
        assertEquals("2023Q3", key.toString());
    }

    @Test
    void rejectsQuarterOutsideYear() {
        assertThrows(IllegalArgumentException.class, () -> new QuarterKey(2023, 0));
        assertThrows(IllegalArgumentException.class, () -> new QuarterKey(2023, 5));
    }
}
