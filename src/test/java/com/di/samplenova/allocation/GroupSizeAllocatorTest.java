package com.di.samplenova.allocation;

import com.di.samplenova.exception.TooManyGroupsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for GroupSizeAllocator.
 */
@DisplayName("GroupSizeAllocator Tests")
class GroupSizeAllocatorTest {

    // ============================================================================
    // Exact allocation
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
        "4, 2",
        "2, 1",
        "6, 6",
        "5, 3",
        "100, 100"
    })
    @DisplayName("Should find the largest whole cap within the budget for groups of 4 and 2 (plateaus once the cap covers every group)")
    void testExact_KnownValues(long target, int expected) {
        assertEquals(expected, GroupSizeAllocator.calculateExactSequencesPerGroup(target, List.of(4, 2)));
    }

    @Test
    @DisplayName("Should not stop short of the largest feasible cap")
    void testExact_LargestFeasible() {
        // min(4, 1) + min(4, 5) = 5 fits the budget, 5 does not.
        assertEquals(4, GroupSizeAllocator.calculateExactSequencesPerGroup(5, List.of(1, 5)));
    }

    @Test
    @DisplayName("Should fail with more groups than the budget")
    void testExact_TooManyGroups() {
        TooManyGroupsException ex = assertThrows(TooManyGroupsException.class,
                () -> GroupSizeAllocator.calculateExactSequencesPerGroup(1, List.of(4, 2)));
        assertEquals("Asked to provide at most 1 sequences, but there are 2 groups.", ex.getMessage());
        assertEquals(1, ex.getTargetMaxValue());
        assertEquals(2, ex.getGroupCount());
    }

    @Test
    @DisplayName("Should be monotonic in the budget and never exceed it")
    void testExact_MonotonicAndWithinBudget() {
        List<Integer> sizes = List.of(1, 3, 7, 7, 12, 40, 2, 9);
        int previous = 0;
        for (long target = sizes.size(); target <= 120; target++) {
            int cap = GroupSizeAllocator.calculateExactSequencesPerGroup(target, sizes);
            assertTrue(cap >= previous, "cap decreased at target " + target);
            assertTrue(GroupSizeAllocator.totalSequences((long) cap, sizes) <= target, "budget exceeded at " + target);
            previous = cap;
        }
    }

    @Test
    @DisplayName("Should reject negative inputs")
    void testExact_InvalidInputs() {
        assertThrows(IllegalArgumentException.class,
                () -> GroupSizeAllocator.calculateExactSequencesPerGroup(-1, List.of(1)));
        assertThrows(IllegalArgumentException.class,
                () -> GroupSizeAllocator.calculateExactSequencesPerGroup(5, List.of(1, -2)));
        assertThrows(IllegalArgumentException.class,
                () -> GroupSizeAllocator.calculateExactSequencesPerGroup(5, null));
    }

    // ============================================================================
    // Fractional allocation
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
        "4, 1.9375",
        "2, 0.9688",
        "1, 0.4844"
    })
    @DisplayName("Should find a fractional cap for groups of 4 and 2")
    void testFractional_KnownValues(long target, double expected) {
        assertEquals(expected, GroupSizeAllocator.calculateFractionalSequencesPerGroup(target, List.of(4, 2)), 1e-4);
    }

    @Test
    @DisplayName("Should keep the expected total within the budget")
    void testFractional_WithinBudget() {
        List<Integer> sizes = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            sizes.add(1 + i % 4);
        }
        double cap = GroupSizeAllocator.calculateFractionalSequencesPerGroup(10, sizes);
        assertTrue(cap > 0 && cap < 1);
        assertTrue(cap * sizes.size() <= 10 * 1.1);
    }

    // ============================================================================
    // Combined entry point
    // ============================================================================

    @Test
    @DisplayName("Should use the exact cap when it fits")
    void testCalculate_Exact() {
        List<String> warnings = new ArrayList<>();
        GroupCap cap = GroupSizeAllocator.calculateSequencesPerGroup(4, List.of(4, 2), true, warnings::add);

        assertEquals(GroupCap.exact(2), cap);
        assertFalse(cap.probabilistic());
        assertTrue(warnings.isEmpty());
    }

    @Test
    @DisplayName("Should fall back to a probabilistic cap and warn")
    void testCalculate_ProbabilisticFallback() {
        List<String> warnings = new ArrayList<>();
        GroupCap cap = GroupSizeAllocator.calculateSequencesPerGroup(1, List.of(4, 2), true, warnings::add);

        assertTrue(cap.probabilistic());
        assertEquals(0.4844, cap.sequencesPerGroup(), 1e-4);
        assertEquals(List.of("Asked to provide at most 1 sequences, but there are 2 groups."), warnings);
    }

    @Test
    @DisplayName("Should propagate too many groups when probabilistic sampling is disabled")
    void testCalculate_ProbabilisticDisabled() {
        assertThrows(TooManyGroupsException.class,
                () -> GroupSizeAllocator.calculateSequencesPerGroup(1, List.of(4, 2), false, message -> { }));
    }

    @Test
    @DisplayName("Should reject reading an exact value from a probabilistic cap")
    void testGroupCap_ExactValue() {
        assertEquals(3, GroupCap.exact(3).exactValue());
        assertThrows(IllegalStateException.class, () -> GroupCap.probabilistic(0.5).exactValue());
        assertThrows(IllegalArgumentException.class, () -> new GroupCap(1.5, false));
        assertThrows(IllegalArgumentException.class, () -> GroupCap.probabilistic(-0.1));
    }
}
