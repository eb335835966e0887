// file: storage/src/test/java/io/budgetsync/storage/CounterRangeTest.java
package io.budgetsync.storage;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CounterRangeTest {

    @Test
    void file_name_round_trips() {
        var r = CounterRange.after(15, 3);

        assertEquals("16_18.delta", r.fileName());
        assertEquals(Optional.of(r), CounterRange.parseFileName(r.fileName()));
        assertEquals(3, r.size());
    }

    @Test
    void malformed_names_do_not_parse() {
        assertTrue(CounterRange.parseFileName("16-18.delta").isEmpty());
        assertTrue(CounterRange.parseFileName("18_16.delta").isEmpty());
        assertTrue(CounterRange.parseFileName("0_4.delta").isEmpty());
        assertTrue(CounterRange.parseFileName("16_18.delta.tmp").isEmpty());
        assertTrue(CounterRange.parseFileName("99999999999999999999_1.delta").isEmpty());
    }

    @Test
    void empty_or_inverted_ranges_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> CounterRange.after(10, 0));
        assertThrows(IllegalArgumentException.class, () -> new CounterRange(5, 4));
    }
}
