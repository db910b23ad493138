package io.enumeris.kernel;

import java.util.Arrays;
import java.util.BitSet;
import java.util.NoSuchElementException;

/**
 * Immutable set of non-negative bit indexes backed by a word array.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Every operation that changes membership returns a new instance; the receiver never changes.</li>
 *   <li>The word array is trimmed: the last word is non-zero, so equal sets have equal arrays.</li>
 *   <li>Words use little-endian bit order, the layout of {@link BitSet#toLongArray()}.</li>
 *   <li>Enumeration is in ascending index order.</li>
 * </ul>
 * <p>
 * An operation that would not change membership returns the receiver itself.
 */
public final class IdBitSet {
    private static final int ADDRESS_BITS_PER_WORD = 6;
    private static final int BITS_PER_WORD = 1 << ADDRESS_BITS_PER_WORD;
    private static final long[] NO_WORDS = new long[0];

    public static final IdBitSet EMPTY = new IdBitSet(NO_WORDS);

    private final long[] words;
    private final int cardinality;

    private IdBitSet(long[] words) {
        this.words = words;
        var count = 0;
        for (long word : words) {
            count += Long.bitCount(word);
        }
        this.cardinality = count;
    }

    /**
     * Returns a set containing the given indexes.
     */
    public static IdBitSet of(int... indexes) {
        var builder = new Builder();
        for (int index : indexes) {
            builder.set(index);
        }
        return builder.build();
    }

    /**
     * Returns a set whose members are the bits set in {@code words}.
     * The array is copied; trailing zero words are dropped.
     */
    public static IdBitSet fromLongArray(long[] words) {
        return wrap(words.clone());
    }

    private static IdBitSet wrap(long[] words) {
        var length = words.length;
        while (length > 0 && words[length - 1] == 0L) {
            length--;
        }
        if (length == 0) {
            return EMPTY;
        }
        return new IdBitSet(length == words.length ? words : Arrays.copyOf(words, length));
    }

    public int cardinality() {
        return cardinality;
    }

    public boolean isEmpty() {
        return cardinality == 0;
    }

    /**
     * One past the highest member, or 0 when empty.
     */
    public int length() {
        return lastSetBit() + 1;
    }

    public boolean get(int index) {
        if (index < 0) {
            return false;
        }
        var wordIndex = index >>> ADDRESS_BITS_PER_WORD;
        return wordIndex < words.length && (words[wordIndex] & (1L << index)) != 0L;
    }

    public IdBitSet set(int index) {
        checkIndex(index);
        if (get(index)) {
            return this;
        }
        var wordIndex = index >>> ADDRESS_BITS_PER_WORD;
        var result = Arrays.copyOf(words, Math.max(words.length, wordIndex + 1));
        result[wordIndex] |= 1L << index;
        return new IdBitSet(result);
    }

    public IdBitSet clear(int index) {
        if (!get(index)) {
            return this;
        }
        var result = words.clone();
        result[index >>> ADDRESS_BITS_PER_WORD] &= ~(1L << index);
        return wrap(result);
    }

    public IdBitSet or(IdBitSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        var longer = words.length >= other.words.length ? words : other.words;
        var shorter = longer == words ? other.words : words;
        var result = longer.clone();
        for (var i = 0; i < shorter.length; i++) {
            result[i] |= shorter[i];
        }
        return new IdBitSet(result);
    }

    public IdBitSet and(IdBitSet other) {
        var length = Math.min(words.length, other.words.length);
        var result = new long[length];
        for (var i = 0; i < length; i++) {
            result[i] = words[i] & other.words[i];
        }
        return wrap(result);
    }

    public IdBitSet andNot(IdBitSet other) {
        if (isEmpty() || other.isEmpty()) {
            return this;
        }
        var result = words.clone();
        var length = Math.min(words.length, other.words.length);
        for (var i = 0; i < length; i++) {
            result[i] &= ~other.words[i];
        }
        return wrap(result);
    }

    /**
     * Members in {@code [fromInclusive, toExclusive)}. Bounds outside the
     * populated range are clamped.
     */
    public IdBitSet range(int fromInclusive, int toExclusive) {
        var from = Math.max(0, fromInclusive);
        var to = Math.min(toExclusive, length());
        if (from >= to) {
            return EMPTY;
        }
        if (from == 0 && to == length()) {
            return this;
        }
        var result = Arrays.copyOf(words, ((to - 1) >>> ADDRESS_BITS_PER_WORD) + 1);
        var fromWord = from >>> ADDRESS_BITS_PER_WORD;
        Arrays.fill(result, 0, fromWord, 0L);
        result[fromWord] &= -1L << from;
        result[result.length - 1] &= -1L >>> -to;
        return wrap(result);
    }

    /**
     * Adds {@code distance} to every member.
     */
    public IdBitSet shiftUp(int distance) {
        if (distance < 0) {
            throw new IllegalArgumentException("distance must be non-negative: " + distance);
        }
        if (distance == 0 || isEmpty()) {
            return this;
        }
        if ((long) lastSetBit() + distance > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("shift overflows bit index range: " + distance);
        }
        var wordShift = distance >>> ADDRESS_BITS_PER_WORD;
        var bitShift = distance & (BITS_PER_WORD - 1);
        var result = new long[words.length + wordShift + 1];
        for (var i = 0; i < words.length; i++) {
            result[i + wordShift] |= words[i] << bitShift;
            if (bitShift != 0) {
                result[i + wordShift + 1] |= words[i] >>> (BITS_PER_WORD - bitShift);
            }
        }
        return wrap(result);
    }

    /**
     * Lowest member at or above {@code fromIndex}, or -1.
     */
    public int nextSetBit(int fromIndex) {
        if (fromIndex < 0) {
            throw new IndexOutOfBoundsException("fromIndex < 0: " + fromIndex);
        }
        var wordIndex = fromIndex >>> ADDRESS_BITS_PER_WORD;
        if (wordIndex >= words.length) {
            return -1;
        }
        var word = words[wordIndex] & (-1L << fromIndex);
        while (true) {
            if (word != 0L) {
                return (wordIndex * BITS_PER_WORD) + Long.numberOfTrailingZeros(word);
            }
            if (++wordIndex == words.length) {
                return -1;
            }
            word = words[wordIndex];
        }
    }

    /**
     * Highest member, or -1 when empty.
     */
    public int lastSetBit() {
        if (words.length == 0) {
            return -1;
        }
        var last = words.length - 1;
        return last * BITS_PER_WORD + (BITS_PER_WORD - 1 - Long.numberOfLeadingZeros(words[last]));
    }

    /**
     * Whether every member of {@code other} is a member of this set.
     */
    public boolean containsAll(IdBitSet other) {
        if (other.words.length > words.length) {
            return false;
        }
        for (var i = 0; i < other.words.length; i++) {
            if ((other.words[i] & ~words[i]) != 0L) {
                return false;
            }
        }
        return true;
    }

    /**
     * Snapshot copy of the trimmed word array.
     */
    public long[] toLongArray() {
        return words.clone();
    }

    public IntEnumerator enumerator() {
        return enumerator(0);
    }

    /**
     * Enumerates members at or above {@code fromIndex} in ascending order.
     */
    public IntEnumerator enumerator(int fromIndex) {
        return new IntEnumerator() {
            private int next = fromIndex < 0 ? nextSetBit(0) : nextSetBit(fromIndex);

            @Override
            public boolean hasNext() {
                return next >= 0;
            }

            @Override
            public int nextInt() {
                if (next < 0) {
                    throw new NoSuchElementException();
                }
                var value = next;
                next = value == Integer.MAX_VALUE ? -1 : nextSetBit(value + 1);
                return value;
            }
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(words, ((IdBitSet) obj).words);
    }

    @Override
    public int hashCode() {
        long h = 1234;
        for (var i = words.length; --i >= 0; ) {
            h ^= words[i] * (i + 1);
        }
        return (int) ((h >> 32) ^ h);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("{");
        var e = enumerator();
        while (e.hasNext()) {
            sb.append(e.nextInt());
            if (e.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append('}').toString();
    }

    private static void checkIndex(int index) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("bit index negative: " + index);
        }
    }

    /**
     * Mutable accumulator for building an {@link IdBitSet} in one pass.
     * Not thread-safe.
     */
    public static final class Builder {
        private final BitSet bits = new BitSet();

        public Builder set(int index) {
            checkIndex(index);
            bits.set(index);
            return this;
        }

        public IdBitSet build() {
            return wrap(bits.toLongArray());
        }
    }
}
