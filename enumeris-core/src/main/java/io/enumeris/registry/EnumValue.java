package io.enumeris.registry;

import io.enumeris.core.EnumerisException;
import io.enumeris.core.UnknownNameException;

import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.Objects;

/**
 * Base class of the values of an {@link Enumeration}.
 * <p>
 * Subclasses add state and behaviour and keep their constructor private,
 * passing the {@link Registration} through:
 * <pre>
 * public final class Day extends EnumValue&lt;Day&gt; {
 *     public static final Enumeration&lt;Day&gt; DAYS = Enumeration.of(Day.class);
 *     public static final Day MONDAY = DAYS.declare("Monday", Day::new);
 *
 *     private Day(Registration&lt;Day&gt; registration) {
 *         super(registration);
 *     }
 * }
 * </pre>
 * <p>
 * Two values are equal iff they belong to the same enumeration instance and
 * carry the same id. Values order by id.
 *
 * @param <V> the value type itself
 */
public abstract class EnumValue<V extends EnumValue<V>> implements Comparable<V>, Serializable {

    private static final long serialVersionUID = 1L;

    private final transient Enumeration<V> enumeration;
    private final int id;
    private final transient String declaredName;

    protected EnumValue(Registration<V> registration) {
        Objects.requireNonNull(registration, "registration");
        registration.claim();
        this.enumeration = registration.enumeration();
        this.id = registration.id();
        this.declaredName = registration.name();
    }

    /**
     * The id and bit location of this value.
     */
    public final int id() {
        return id;
    }

    public final Enumeration<V> enumeration() {
        return enumeration;
    }

    /**
     * Display name of this value; same as {@link #toString()}.
     */
    public final String name() {
        return toString();
    }

    /**
     * Set containing this value and {@code other}.
     */
    public final ValueSet<V> combine(V other) {
        return enumeration.setOf(self(), other);
    }

    @SuppressWarnings("unchecked")
    final V self() {
        return (V) this;
    }

    @Override
    public final int compareTo(V other) {
        return Integer.compare(id, other.id());
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EnumValue<?> other)) {
            return false;
        }
        return enumeration == other.enumeration && id == other.id;
    }

    @Override
    public final int hashCode() {
        return Integer.hashCode(id);
    }

    /**
     * The explicit name, the declared name resolved through the enumeration's
     * name source, or a placeholder naming the id when neither exists.
     */
    @Override
    public String toString() {
        try {
            var resolved = resolvedName();
            return resolved != null ? resolved : "<Invalid enum: no field for #" + id + ">";
        } catch (EnumerisException e) {
            return "<Invalid enum: no field for #" + id + ">";
        }
    }

    /**
     * The explicit or declared name, or null while the name source does not know it yet.
     */
    final String resolvedName() {
        if (declaredName != null) {
            return declaredName;
        }
        try {
            return enumeration.nameOf(id);
        } catch (UnknownNameException e) {
            return null;
        }
    }

    protected final Object writeReplace() {
        return new SerializedValue(enumeration, id);
    }

    private void readObject(ObjectInputStream in) throws InvalidObjectException {
        throw new InvalidObjectException("EnumValue is restored through its serialized form");
    }
}
