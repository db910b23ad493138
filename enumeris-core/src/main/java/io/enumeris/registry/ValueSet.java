package io.enumeris.registry;

import io.enumeris.core.CrossRegistryOperationException;
import io.enumeris.core.UnknownNameException;
import io.enumeris.kernel.IdBitSet;
import io.enumeris.kernel.IntEnumerator;

import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Immutable set of values of one {@link Enumeration}, ordered by id.
 * <p>
 * Backed by an {@link IdBitSet} in which bit {@code id - bottom} marks a member,
 * {@code bottom} being the enumeration's {@link Enumeration#minId() minId} when
 * the set was built. Membership tests are a single bit test; union, intersection
 * and difference are word-wise operations.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Every operation returns a new set; the receiver never changes.
 *       The mutators of {@link java.util.Set} throw {@link UnsupportedOperationException}.</li>
 *   <li>Iteration is in ascending id order. Iterators are independent and read-only.</li>
 *   <li>Combining sets or values of different enumerations throws
 *       {@link CrossRegistryOperationException}.</li>
 *   <li>Equality follows the {@link java.util.Set} contract.</li>
 * </ul>
 *
 * @param <V> value type
 */
public final class ValueSet<V extends EnumValue<V>> extends AbstractSet<V> implements SortedSet<V>, Serializable {

    private static final long serialVersionUID = 1L;

    private final Enumeration<V> enumeration;
    private final int bottom;
    private final IdBitSet bits;

    // Built on first name lookup once every member is named; racing builds produce equal maps
    private transient volatile Map<String, V> byName;

    ValueSet(Enumeration<V> enumeration, int bottom, IdBitSet bits) {
        this.enumeration = enumeration;
        this.bottom = bottom;
        this.bits = bits;
    }

    public Enumeration<V> enumeration() {
        return enumeration;
    }

    @Override
    public int size() {
        return bits.cardinality();
    }

    @Override
    public boolean isEmpty() {
        return bits.isEmpty();
    }

    @Override
    public boolean contains(Object o) {
        if (!(o instanceof EnumValue<?> value) || value.enumeration() != enumeration) {
            return false;
        }
        return bits.get(value.id() - bottom);
    }

    @Override
    public boolean containsAll(Collection<?> c) {
        if (c instanceof ValueSet<?> other && other.enumeration == enumeration) {
            var base = Math.min(bottom, other.bottom);
            return rebase(base).bits.containsAll(other.rebase(base).bits);
        }
        return super.containsAll(c);
    }

    // ------------------------------------------------------------------ persistent updates

    /**
     * This set plus {@code value}.
     */
    public ValueSet<V> with(V value) {
        enumeration.checkOwned(value);
        var base = value.id() < bottom ? rebase(enumeration.minId()) : this;
        var updated = base.bits.set(value.id() - base.bottom);
        return updated == base.bits ? base : new ValueSet<>(enumeration, base.bottom, updated);
    }

    /**
     * This set minus {@code value}.
     */
    public ValueSet<V> without(V value) {
        enumeration.checkOwned(value);
        if (!contains(value)) {
            return this;
        }
        return new ValueSet<>(enumeration, bottom, bits.clear(value.id() - bottom));
    }

    public ValueSet<V> union(ValueSet<V> other) {
        checkSameEnumeration(other);
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        var base = Math.min(bottom, other.bottom);
        return new ValueSet<>(enumeration, base, rebase(base).bits.or(other.rebase(base).bits));
    }

    public ValueSet<V> intersect(ValueSet<V> other) {
        checkSameEnumeration(other);
        var base = Math.min(bottom, other.bottom);
        return new ValueSet<>(enumeration, base, rebase(base).bits.and(other.rebase(base).bits));
    }

    public ValueSet<V> difference(ValueSet<V> other) {
        checkSameEnumeration(other);
        if (other.isEmpty()) {
            return this;
        }
        var base = Math.min(bottom, other.bottom);
        return new ValueSet<>(enumeration, base, rebase(base).bits.andNot(other.rebase(base).bits));
    }

    // ------------------------------------------------------------------ iteration

    @Override
    public Iterator<V> iterator() {
        return iterate(bits.enumerator());
    }

    /**
     * Iterates the members whose id is at least {@code start}'s id.
     */
    public Iterator<V> iteratorFrom(V start) {
        enumeration.checkOwned(start);
        return iterate(bits.enumerator(Math.max(0, start.id() - bottom)));
    }

    private Iterator<V> iterate(IntEnumerator e) {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return e.hasNext();
            }

            @Override
            public V next() {
                return enumeration.valueById(bottom + e.nextInt());
            }
        };
    }

    // ------------------------------------------------------------------ sorted views

    /**
     * Always null: values use their natural ordering, by id.
     */
    @Override
    public Comparator<? super V> comparator() {
        return null;
    }

    @Override
    public V first() {
        if (isEmpty()) {
            throw new NoSuchElementException("empty " + enumeration + ".ValueSet");
        }
        return enumeration.valueById(bottom + bits.nextSetBit(0));
    }

    @Override
    public V last() {
        if (isEmpty()) {
            throw new NoSuchElementException("empty " + enumeration + ".ValueSet");
        }
        return enumeration.valueById(bottom + bits.lastSetBit());
    }

    /**
     * Members with ids in {@code [fromInclusive, untilExclusive)}; a null bound is open.
     */
    public ValueSet<V> range(V fromInclusive, V untilExclusive) {
        var from = 0;
        var until = Integer.MAX_VALUE;
        if (fromInclusive != null) {
            enumeration.checkOwned(fromInclusive);
            from = fromInclusive.id() - bottom;
        }
        if (untilExclusive != null) {
            enumeration.checkOwned(untilExclusive);
            until = untilExclusive.id() - bottom;
        }
        var sliced = bits.range(from, until);
        return sliced == bits ? this : new ValueSet<>(enumeration, bottom, sliced);
    }

    @Override
    public ValueSet<V> subSet(V fromElement, V toElement) {
        Objects.requireNonNull(fromElement, "fromElement");
        Objects.requireNonNull(toElement, "toElement");
        if (fromElement.compareTo(toElement) > 0) {
            throw new IllegalArgumentException("fromElement " + fromElement + " > toElement " + toElement);
        }
        return range(fromElement, toElement);
    }

    @Override
    public ValueSet<V> headSet(V toElement) {
        return range(null, Objects.requireNonNull(toElement, "toElement"));
    }

    @Override
    public ValueSet<V> tailSet(V fromElement) {
        return range(Objects.requireNonNull(fromElement, "fromElement"), null);
    }

    // ------------------------------------------------------------------ transformations

    public ValueSet<V> filter(Predicate<? super V> predicate) {
        var builder = new IdBitSet.Builder();
        var e = bits.enumerator();
        while (e.hasNext()) {
            var index = e.nextInt();
            if (predicate.test(enumeration.valueById(bottom + index))) {
                builder.set(index);
            }
        }
        return new ValueSet<>(enumeration, bottom, builder.build());
    }

    /**
     * Maps every member to a value of the same enumeration.
     * Use {@link #mapToSortedSet} or {@link #mapToList} for other result types.
     *
     * @throws CrossRegistryOperationException if {@code mapper} returns a value of another enumeration
     */
    public ValueSet<V> map(Function<? super V, ? extends V> mapper) {
        var base = enumeration.minId();
        var builder = new IdBitSet.Builder();
        for (V value : this) {
            V mapped = mapper.apply(value);
            enumeration.checkOwned(mapped);
            builder.set(mapped.id() - base);
        }
        return new ValueSet<>(enumeration, base, builder.build());
    }

    /**
     * @throws CrossRegistryOperationException if {@code mapper} yields a value of another enumeration
     */
    public ValueSet<V> flatMap(Function<? super V, ? extends Iterable<? extends V>> mapper) {
        var base = enumeration.minId();
        var builder = new IdBitSet.Builder();
        for (V value : this) {
            for (V mapped : mapper.apply(value)) {
                enumeration.checkOwned(mapped);
                builder.set(mapped.id() - base);
            }
        }
        return new ValueSet<>(enumeration, base, builder.build());
    }

    /**
     * Maps members to any naturally ordered type.
     *
     * @return an unmodifiable sorted set
     */
    public <R extends Comparable<? super R>> SortedSet<R> mapToSortedSet(Function<? super V, ? extends R> mapper) {
        var result = new TreeSet<R>();
        for (V value : this) {
            result.add(mapper.apply(value));
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * Maps every member to any number of naturally ordered results.
     *
     * @return an unmodifiable sorted set
     */
    public <R extends Comparable<? super R>> SortedSet<R> flatMapToSortedSet(
            Function<? super V, ? extends Iterable<? extends R>> mapper) {
        var result = new TreeSet<R>();
        for (V value : this) {
            for (R mapped : mapper.apply(value)) {
                result.add(mapped);
            }
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * Maps members in iteration order, keeping duplicates.
     *
     * @return an unmodifiable list
     */
    public <R> List<R> mapToList(Function<? super V, ? extends R> mapper) {
        var result = new ArrayList<R>(size());
        for (V value : this) {
            result.add(mapper.apply(value));
        }
        return Collections.unmodifiableList(result);
    }

    // ------------------------------------------------------------------ export

    /**
     * Bitmask of the members: bit {@code k} (little-endian within each word) marks
     * id {@code enumeration().minId() + k}. Trailing zero words are omitted.
     *
     * @see Enumeration#fromBitMask(long[])
     */
    public long[] toBitMask() {
        return rebase(enumeration.minId()).bits.toLongArray();
    }

    // ------------------------------------------------------------------ names

    /**
     * The member displayed as {@code name}.
     *
     * @throws UnknownNameException if no member has that name
     */
    public V withName(String name) {
        return findByName(name).orElseThrow(() -> new UnknownNameException(enumeration.name(), name));
    }

    public Optional<V> findByName(String name) {
        return Optional.ofNullable(nameIndex().get(name));
    }

    private Map<String, V> nameIndex() {
        var index = byName;
        if (index != null) {
            return index;
        }
        var names = new HashMap<String, V>();
        var complete = true;
        for (V value : this) {
            var name = value.resolvedName();
            if (name == null) {
                complete = false;
                continue;
            }
            names.putIfAbsent(name, value);
        }
        index = Collections.unmodifiableMap(names);
        // Unresolved names may appear once the declaring class finishes initializing
        if (complete) {
            byName = index;
        }
        return index;
    }

    // ------------------------------------------------------------------ internals

    private ValueSet<V> rebase(int newBottom) {
        if (newBottom >= bottom) {
            return this;
        }
        return new ValueSet<>(enumeration, newBottom, bits.shiftUp(bottom - newBottom));
    }

    private void checkSameEnumeration(ValueSet<?> other) {
        Objects.requireNonNull(other, "other");
        if (other.enumeration != enumeration) {
            throw new CrossRegistryOperationException(enumeration.name(), other.enumeration.name());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (o instanceof ValueSet<?> other && other.enumeration == enumeration) {
            var base = Math.min(bottom, other.bottom);
            return rebase(base).bits.equals(other.rebase(base).bits);
        }
        return super.equals(o);
    }

    @Override
    public int hashCode() {
        var h = 0;
        var e = bits.enumerator();
        while (e.hasNext()) {
            h += Integer.hashCode(bottom + e.nextInt());
        }
        return h;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(enumeration.name()).append(".ValueSet(");
        var it = iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append(')').toString();
    }

    @Override
    public boolean add(V v) {
        throw immutable();
    }

    @Override
    public boolean remove(Object o) {
        throw immutable();
    }

    @Override
    public boolean addAll(Collection<? extends V> c) {
        throw immutable();
    }

    @Override
    public boolean removeAll(Collection<?> c) {
        throw immutable();
    }

    @Override
    public boolean retainAll(Collection<?> c) {
        throw immutable();
    }

    @Override
    public boolean removeIf(Predicate<? super V> filter) {
        throw immutable();
    }

    @Override
    public void clear() {
        throw immutable();
    }

    private static UnsupportedOperationException immutable() {
        return new UnsupportedOperationException("ValueSet is immutable; use with/without/union/difference");
    }

    private Object writeReplace() {
        return new SerializedValueSet(enumeration, toBitMask());
    }

    private void readObject(ObjectInputStream in) throws InvalidObjectException {
        throw new InvalidObjectException("ValueSet is restored through its serialized form");
    }
}
