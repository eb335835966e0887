// file: core/src/test/java/io/budgetsync/core/EntityVersionTest.java
package io.budgetsync.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntityVersionTest {

    @Test
    void parses_and_prints_tag_counter_form() {
        var v = EntityVersion.parse("A-86");
        assertEquals("A", v.writerTag());
        assertEquals(86, v.counter());
        assertEquals("A-86", v.toString());
    }

    @Test
    void higher_counter_wins_regardless_of_writer() {
        var fromA = new EntityVersion("A", 15);
        var fromB = new EntityVersion("B", 10);

        assertTrue(fromA.isNewerThan(fromB), "counter decides, not the tag");
        assertFalse(fromB.isNewerThan(fromA));
    }

    @Test
    void equal_counters_are_ordered_by_tag_so_order_stays_total() {
        var a = new EntityVersion("A", 7);
        var b = new EntityVersion("B", 7);

        assertTrue(a.compareTo(b) < 0);
        assertTrue(b.compareTo(a) > 0);
        assertEquals(0, a.compareTo(new EntityVersion("A", 7)));
    }

    @Test
    void rejects_malformed_text() {
        assertThrows(IllegalArgumentException.class, () -> EntityVersion.parse("86"));
        assertThrows(IllegalArgumentException.class, () -> EntityVersion.parse("a-86"));
        assertThrows(IllegalArgumentException.class, () -> EntityVersion.parse("A-"));
        assertThrows(IllegalArgumentException.class, () -> EntityVersion.parse(null));
        assertThrows(IllegalArgumentException.class, () -> new EntityVersion("A", -1));
    }
}
