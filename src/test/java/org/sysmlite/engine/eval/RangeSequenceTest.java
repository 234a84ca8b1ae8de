package org.sysmlite.engine.eval;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RangeSequenceTest {

    @Test
    void inclusiveBounds() {
        RangeSequence range = new RangeSequence(3, 6);
        assertEquals(4, range.size());
        assertEquals(3L, range.get(0));
        assertEquals(6L, range.get(3));
        assertEquals(List.of(3L, 4L, 5L, 6L), range);
        assertEquals("3..6", range.toString());
    }

    @Test
    void invertedBoundsAreEmpty() {
        RangeSequence range = new RangeSequence(5, 1);
        assertTrue(range.isEmpty());
        assertThrows(IndexOutOfBoundsException.class, () -> range.get(0));
    }

    @Test
    void iterationCanBeRepeated() {
        RangeSequence range = new RangeSequence(1, 3);
        List<Object> first = new ArrayList<>(range);
        List<Object> second = new ArrayList<>(range);
        assertEquals(first, second);
    }

    @Test
    void hugeRangeIsNotMaterialized() {
        RangeSequence range = new RangeSequence(1, 2_000_000_000L);
        assertEquals(2_000_000_000, range.size());
        assertEquals(1_999_999_999L, range.get(1_999_999_998));
        assertTrue(range.contains(1_500_000_000L));
        assertFalse(range.contains(0L));
        assertFalse(range.contains("1"));
    }

    @Test
    void countBeyondIntRange() {
        RangeSequence range = new RangeSequence(0, 3_000_000_000L);
        assertEquals(3_000_000_001L, range.count());
        assertEquals(Integer.MAX_VALUE, range.size());
        assertFalse(range.isEmpty());
        assertEquals(3_000_000_000L, range.valueAt(3_000_000_000L));
        assertThrows(IndexOutOfBoundsException.class, () -> range.valueAt(3_000_000_001L));
        assertEquals(0L, range.iterator().next());
    }

    @Test
    void iteratesPastIntSize() {
        RangeSequence range = new RangeSequence(Integer.MAX_VALUE - 1L, Integer.MAX_VALUE + 1L);
        assertEquals(List.of(2147483646L, 2147483647L, 2147483648L), new ArrayList<>(range));
    }

    @Test
    void tailDropsTheFirstValue() {
        assertEquals(List.of(2L, 3L), new RangeSequence(1, 3).tail());
        assertTrue(new RangeSequence(1, 1).tail().isEmpty());
        assertTrue(new RangeSequence(Long.MAX_VALUE, Long.MAX_VALUE).tail().isEmpty());
    }

    @Test
    void countMustFitInALong() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new RangeSequence(Long.MIN_VALUE, 0));
        assertEquals("Range -9223372036854775808..0 is too large", e.getMessage());
        assertEquals(Long.MAX_VALUE, RangeSequence.countOf(0, Long.MAX_VALUE - 1));
    }
}
