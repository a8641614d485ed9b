package com.ninesync.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Compressed set of positive integers (message UIDs) kept as an ordered list
 * of closed intervals. Adjacent and overlapping intervals are always merged,
 * so two ranges holding the same integers are {@link #equals equal}.
 *
 * <p>Text form is the IMAP sequence-set syntax: {@code 1:5,7,9:12}.</p>
 */
public final class UidRange implements Iterable<Long> {

    private static final UidRange EMPTY = new UidRange(new long[0]);

    /** Pairs of [low, high], sorted, disjoint and non-adjacent. */
    private final long[] bounds;

    private UidRange(long[] bounds) {
        this.bounds = bounds;
    }

    public static UidRange empty() {
        return EMPTY;
    }

    public static UidRange of(long... uids) {
        List<Long> list = new ArrayList<>(uids.length);
        for (long uid : uids) {
            list.add(uid);
        }
        return of(list);
    }

    public static UidRange of(Collection<Long> uids) {
        if (uids.isEmpty()) {
            return EMPTY;
        }
        SortedSet<Long> sorted = new TreeSet<>(uids);
        List<long[]> intervals = new ArrayList<>();
        long low = -1;
        long high = -1;
        for (long uid : sorted) {
            if (uid < 1) {
                throw new IllegalArgumentException("UIDs are positive: " + uid);
            }
            if (low < 0) {
                low = uid;
                high = uid;
            } else if (uid == high + 1) {
                high = uid;
            } else {
                intervals.add(new long[]{low, high});
                low = uid;
                high = uid;
            }
        }
        intervals.add(new long[]{low, high});
        return fromIntervals(intervals);
    }

    /**
     * Closed interval [low, high]; empty when {@code low > high}.
     */
    public static UidRange interval(long low, long high) {
        if (low < 1) {
            low = 1;
        }
        if (low > high) {
            return EMPTY;
        }
        return new UidRange(new long[]{low, high});
    }

    /**
     * Parse sequence-set text such as {@code 1:5,7}. Blank text is the empty range.
     */
    public static UidRange parse(String text) {
        if (text == null || text.isBlank()) {
            return EMPTY;
        }
        List<long[]> intervals = new ArrayList<>();
        for (String part : text.trim().split(",")) {
            String item = part.trim();
            if (item.isEmpty()) {
                continue;
            }
            int colon = item.indexOf(':');
            try {
                if (colon > 0) {
                    long a = Long.parseLong(item.substring(0, colon).trim());
                    long b = Long.parseLong(item.substring(colon + 1).trim());
                    intervals.add(new long[]{Math.min(a, b), Math.max(a, b)});
                } else {
                    long a = Long.parseLong(item);
                    intervals.add(new long[]{a, a});
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid UID range: " + text, e);
            }
        }
        return canonical(intervals);
    }

    public boolean isEmpty() {
        return bounds.length == 0;
    }

    public boolean contains(long uid) {
        for (int i = 0; i < bounds.length; i += 2) {
            if (uid < bounds[i]) {
                return false;
            }
            if (uid <= bounds[i + 1]) {
                return true;
            }
        }
        return false;
    }

    /** Number of UIDs in the range. */
    public long size() {
        long n = 0;
        for (int i = 0; i < bounds.length; i += 2) {
            n += bounds[i + 1] - bounds[i] + 1;
        }
        return n;
    }

    public long min() {
        if (isEmpty()) {
            throw new NoSuchElementException("empty range");
        }
        return bounds[0];
    }

    public long max() {
        if (isEmpty()) {
            throw new NoSuchElementException("empty range");
        }
        return bounds[bounds.length - 1];
    }

    public UidRange union(UidRange other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<long[]> intervals = new ArrayList<>(intervals());
        intervals.addAll(other.intervals());
        return canonical(intervals);
    }

    public UidRange intersect(UidRange other) {
        List<long[]> result = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < bounds.length && j < other.bounds.length) {
            long low = Math.max(bounds[i], other.bounds[j]);
            long high = Math.min(bounds[i + 1], other.bounds[j + 1]);
            if (low <= high) {
                result.add(new long[]{low, high});
            }
            if (bounds[i + 1] < other.bounds[j + 1]) {
                i += 2;
            } else {
                j += 2;
            }
        }
        return fromIntervals(result);
    }

    public UidRange intersect(long low, long high) {
        return intersect(interval(low, high));
    }

    public UidRange subtract(UidRange other) {
        if (isEmpty() || other.isEmpty()) {
            return this;
        }
        List<long[]> result = new ArrayList<>();
        int j = 0;
        for (int i = 0; i < bounds.length; i += 2) {
            long low = bounds[i];
            long high = bounds[i + 1];
            while (j < other.bounds.length && other.bounds[j + 1] < low) {
                j += 2;
            }
            int k = j;
            while (low <= high && k < other.bounds.length && other.bounds[k] <= high) {
                if (other.bounds[k] > low) {
                    result.add(new long[]{low, other.bounds[k] - 1});
                }
                low = Math.max(low, other.bounds[k + 1] + 1);
                k += 2;
            }
            if (low <= high) {
                result.add(new long[]{low, high});
            }
        }
        return fromIntervals(result);
    }

    /**
     * UIDs in [low, high] that are not in this range.
     */
    public UidRange complement(long low, long high) {
        return interval(low, high).subtract(this);
    }

    /** Canonical interval list, each element a fresh {@code [low, high]} pair. */
    public List<long[]> intervals() {
        List<long[]> list = new ArrayList<>(bounds.length / 2);
        for (int i = 0; i < bounds.length; i += 2) {
            list.add(new long[]{bounds[i], bounds[i + 1]});
        }
        return list;
    }

    public SortedSet<Long> toSet() {
        SortedSet<Long> set = new TreeSet<>();
        for (long uid : this) {
            set.add(uid);
        }
        return Collections.unmodifiableSortedSet(set);
    }

    @Override
    public Iterator<Long> iterator() {
        return new Iterator<>() {
            private int index = 0;
            private long next = bounds.length > 0 ? bounds[0] : 0;

            @Override
            public boolean hasNext() {
                return index < bounds.length;
            }

            @Override
            public Long next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                long value = next;
                if (next == bounds[index + 1]) {
                    index += 2;
                    if (index < bounds.length) {
                        next = bounds[index];
                    }
                } else {
                    next++;
                }
                return value;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UidRange other)) {
            return false;
        }
        return Arrays.equals(bounds, other.bounds);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bounds);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < bounds.length; i += 2) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(bounds[i]);
            if (bounds[i + 1] != bounds[i]) {
                sb.append(':').append(bounds[i + 1]);
            }
        }
        return sb.toString();
    }

    private static UidRange canonical(List<long[]> intervals) {
        if (intervals.isEmpty()) {
            return EMPTY;
        }
        intervals.sort((a, b) -> Long.compare(a[0], b[0]));
        List<long[]> merged = new ArrayList<>();
        long[] current = intervals.get(0).clone();
        if (current[0] < 1) {
            throw new IllegalArgumentException("UIDs are positive: " + current[0]);
        }
        for (int i = 1; i < intervals.size(); i++) {
            long[] next = intervals.get(i);
            // merge overlapping and adjacent intervals
            if (next[0] <= current[1] + 1) {
                current[1] = Math.max(current[1], next[1]);
            } else {
                merged.add(current);
                current = next.clone();
            }
        }
        merged.add(current);
        return fromIntervals(merged);
    }

    private static UidRange fromIntervals(List<long[]> intervals) {
        if (intervals.isEmpty()) {
            return EMPTY;
        }
        long[] bounds = new long[intervals.size() * 2];
        int i = 0;
        for (long[] interval : intervals) {
            bounds[i++] = interval[0];
            bounds[i++] = interval[1];
        }
        return new UidRange(bounds);
    }
}
