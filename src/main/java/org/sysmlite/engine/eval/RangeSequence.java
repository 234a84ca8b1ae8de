package org.sysmlite.engine.eval;

import java.util.AbstractList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.RandomAccess;

/**
 * Inclusive integer range {@code start..stop} computed on access. Count and
 * positional access are constant time and iteration can be repeated.
 *
 * The exact number of values is {@link #count()}. As a {@link java.util.List}
 * a range holding more than {@link Integer#MAX_VALUE} values reports
 * {@code Integer.MAX_VALUE} from {@link #size()}; iteration still visits every value.
 */
public final class RangeSequence extends AbstractList<Object> implements RandomAccess {

    private final long start;
    private final long stop;
    private final long count;

    /**
     * @throws IllegalArgumentException if the number of values does not fit in a long
     */
    public RangeSequence(long start, long stop) {
        this.start = start;
        this.stop = stop;
        this.count = countOf(start, stop);
    }

    /**
     * @return the number of values in {@code start..stop}
     * @throws IllegalArgumentException if it does not fit in a long
     */
    public static long countOf(long start, long stop) {
        if (stop < start) {
            return 0;
        }
        try {
            return Math.addExact(Math.subtractExact(stop, start), 1);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Range " + start + ".." + stop + " is too large", e);
        }
    }

    public long start() {
        return start;
    }

    public long stop() {
        return stop;
    }

    public long count() {
        return count;
    }

    /**
     * @param position 0-based position, up to {@link #count()}
     */
    public long valueAt(long position) {
        if (position < 0 || position >= count) {
            throw new IndexOutOfBoundsException("Index " + position + " out of bounds for range of size " + count);
        }
        return start + position;
    }

    @Override
    public int size() {
        return (int) Math.min(count, Integer.MAX_VALUE);
    }

    @Override
    public boolean isEmpty() {
        return count == 0;
    }

    @Override
    public Object get(int index) {
        return valueAt(index);
    }

    @Override
    public Iterator<Object> iterator() {
        return new Iterator<>() {
            private long position;

            @Override
            public boolean hasNext() {
                return position < count;
            }

            @Override
            public Object next() {
                if (position >= count) {
                    throw new NoSuchElementException();
                }
                return start + position++;
            }
        };
    }

    @Override
    public boolean contains(Object value) {
        if (value instanceof Long number) {
            return number >= start && number <= stop;
        }
        return false;
    }

    /**
     * @return the range without its first value
     */
    public RangeSequence tail() {
        return count <= 1 ? new RangeSequence(1, 0) : new RangeSequence(start + 1, stop);
    }

    @Override
    public String toString() {
        return start + ".." + stop;
    }
}
