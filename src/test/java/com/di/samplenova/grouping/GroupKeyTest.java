package com.di.samplenova.grouping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for GroupKey.
 */
@DisplayName("GroupKey Tests")
class GroupKeyTest {

    @Test
    @DisplayName("Should be equal when all values match in order")
    void testEquals() {
        assertEquals(GroupKey.of("Africa", 2020), GroupKey.of(List.of("Africa", 2020)));
        assertEquals(GroupKey.of("Africa", 2020).hashCode(), GroupKey.of("Africa", 2020).hashCode());
        assertNotEquals(GroupKey.of("Africa", 2020), GroupKey.of(2020, "Africa"));
        assertNotEquals(GroupKey.of("Africa"), GroupKey.of("Africa", null));
    }

    @Test
    @DisplayName("Should sort element by element")
    void testCompareTo() {
        TreeSet<GroupKey> keys = new TreeSet<>(List.of(
                GroupKey.of("Europe", new MonthGroup(2020, 1)),
                GroupKey.of("Africa", new MonthGroup(2021, 1)),
                GroupKey.of("Africa", new MonthGroup(2020, 12)),
                GroupKey.of("Africa", new MonthGroup(2020, 2))));

        assertEquals(List.of(
                GroupKey.of("Africa", new MonthGroup(2020, 2)),
                GroupKey.of("Africa", new MonthGroup(2020, 12)),
                GroupKey.of("Africa", new MonthGroup(2021, 1)),
                GroupKey.of("Europe", new MonthGroup(2020, 1))), new ArrayList<>(keys));
    }

    @Test
    @DisplayName("Should order null values first and numbers numerically")
    void testCompareTo_NullsAndNumbers() {
        assertTrue(GroupKey.of((Object) null).compareTo(GroupKey.of("a")) < 0);
        assertTrue(GroupKey.of(9).compareTo(GroupKey.of(10)) < 0);
        assertTrue(GroupKey.of("a").compareTo(GroupKey.of("a", "b")) < 0);
        assertEquals(0, GroupKey.of(new IsoWeekGroup(2020, 5)).compareTo(GroupKey.of(new IsoWeekGroup(2020, 5))));
    }

    @Test
    @DisplayName("Should render as a tuple")
    void testToString() {
        assertEquals("(Africa, (2020, 1))", GroupKey.of("Africa", new MonthGroup(2020, 1)).toString());
        assertEquals("(_dummy)", GroupKey.DUMMY.toString());
    }
}
