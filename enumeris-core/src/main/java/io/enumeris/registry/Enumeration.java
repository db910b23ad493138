package io.enumeris.registry;

import io.enumeris.core.CrossRegistryOperationException;
import io.enumeris.core.DeclaredName;
import io.enumeris.core.DuplicateIdentifierException;
import io.enumeris.core.EnumerisConfiguration;
import io.enumeris.core.EnumerisException;
import io.enumeris.core.NameSource;
import io.enumeris.core.UnknownIdentifierException;
import io.enumeris.core.UnknownNameException;
import io.enumeris.kernel.IdBitSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A closed set of uniquely identified singleton values sharing one value type.
 * <p>
 * Values are declared once, usually from static fields of the declaring class,
 * and keep their id for the lifetime of the enumeration:
 * <pre>
 * public final class Color extends EnumValue&lt;Color&gt; {
 *     public static final Enumeration&lt;Color&gt; COLORS = Enumeration.of(Color.class);
 *     public static final Color RED = COLORS.declare(Color::new);
 *     public static final Color GREEN = COLORS.declare(Color::new);
 *
 *     private Color(Registration&lt;Color&gt; registration) {
 *         super(registration);
 *     }
 * }
 * </pre>
 * Values declared without a name are named lazily: the first lookup that misses
 * asks the configured {@link NameSource} (by default the static fields of the
 * declaring class) and caches every name it reports for this enumeration.
 * <p>
 * <b>Thread safety:</b>
 * <ul>
 *   <li>Declarations are serialized by a lock; duplicate ids are rejected before any state changes.</li>
 *   <li>Lookups by id never lock.</li>
 *   <li>{@link #values()} is rebuilt at most once per declaration and published through a volatile field.</li>
 *   <li>Name population runs under its own lock and is re-checked after acquiring it.</li>
 * </ul>
 *
 * @param <V> value type
 * @see ValueSet
 */
public final class Enumeration<V extends EnumValue<V>> implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger log = LoggerFactory.getLogger(Enumeration.class);

    private final Class<V> valueType;
    private final Class<?> declaringClass;
    private final String name;
    private final NameSource nameSource;
    private final List<String> presetNames;

    private final ReentrantLock registrationLock = new ReentrantLock();
    private final ReentrantLock namesLock = new ReentrantLock();
    private final ConcurrentMap<Integer, V> valuesById = new ConcurrentHashMap<>();
    private final ConcurrentMap<Integer, String> namesById = new ConcurrentHashMap<>();
    private final ValueSet<V> emptySet;

    // Guarded by registrationLock
    private int nextId;
    private int presetNameIndex;

    // Written under registrationLock, read without it
    private volatile int topId;
    private volatile int bottomId;
    private volatile int version;
    private volatile Snapshot<V> snapshot;

    private Enumeration(Class<V> valueType, Class<?> declaringClass, EnumerisConfiguration configuration) {
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.declaringClass = Objects.requireNonNull(declaringClass, "declaringClass");
        this.name = configuration.name() != null ? configuration.name() : defaultName(declaringClass);
        this.nameSource = configuration.nameSource();
        this.presetNames = configuration.presetNames();
        this.nextId = configuration.initialId();
        this.topId = configuration.initialId();
        this.bottomId = Math.min(configuration.initialId(), 0);
        this.emptySet = new ValueSet<>(this, bottomId, IdBitSet.EMPTY);
    }

    /**
     * Create an enumeration whose values are declared in the value type itself.
     */
    public static <V extends EnumValue<V>> Enumeration<V> of(Class<V> valueType) {
        return new Enumeration<>(valueType, valueType, EnumerisConfiguration.defaults());
    }

    public static <V extends EnumValue<V>> Enumeration<V> of(Class<V> valueType, EnumerisConfiguration configuration) {
        return new Enumeration<>(valueType, valueType, Objects.requireNonNull(configuration, "configuration"));
    }

    /**
     * Create an enumeration whose values are declared in {@code declaringClass}.
     *
     * @param valueType      the value type
     * @param declaringClass the class holding the constants; scanned for names and
     *                       used to locate this enumeration on deserialization
     * @param configuration  id and naming configuration
     */
    public static <V extends EnumValue<V>> Enumeration<V> of(Class<V> valueType, Class<?> declaringClass,
                                                             EnumerisConfiguration configuration) {
        return new Enumeration<>(valueType, declaringClass, Objects.requireNonNull(configuration, "configuration"));
    }

    private static String defaultName(Class<?> declaringClass) {
        var simpleName = declaringClass.getSimpleName();
        return simpleName.isEmpty() ? declaringClass.getName() : simpleName;
    }

    // ------------------------------------------------------------------ declaration

    /**
     * Declare a value with the next id. Its name comes from the preset names,
     * else from the name source on first use.
     */
    public V declare(ValueFactory<V> factory) {
        return register(null, null, factory);
    }

    /**
     * Declare a value with the next id and an explicit name.
     */
    public V declare(String name, ValueFactory<V> factory) {
        return register(null, Objects.requireNonNull(name, "name"), factory);
    }

    /**
     * Declare a value with an explicit id. Following automatic ids continue from {@code id + 1}.
     *
     * @throws DuplicateIdentifierException if {@code id} is taken
     */
    public V declare(int id, ValueFactory<V> factory) {
        return register(id, null, factory);
    }

    /**
     * Declare a value with an explicit id and name.
     *
     * @throws DuplicateIdentifierException if {@code id} is taken
     */
    public V declare(int id, String name, ValueFactory<V> factory) {
        return register(id, Objects.requireNonNull(name, "name"), factory);
    }

    private V register(Integer explicitId, String explicitName, ValueFactory<V> factory) {
        Objects.requireNonNull(factory, "factory");
        registrationLock.lock();
        try {
            int id = explicitId != null ? explicitId : nextId;
            if (valuesById.containsKey(id)) {
                throw new DuplicateIdentifierException(name, id);
            }
            checkIdRange(id);
            var usePreset = explicitName == null && presetNameIndex < presetNames.size();
            var valueName = usePreset ? presetNames.get(presetNameIndex) : explicitName;

            var registration = new Registration<>(this, id, valueName);
            V value = factory.create(registration);
            if (value == null || !registration.isClaimed() || value.enumeration() != this || value.id() != id) {
                throw new EnumerisException("Factory for id " + id + " in enumeration " + name
                        + " did not construct a value from its registration");
            }
            if (!valueType.isInstance(value)) {
                throw new EnumerisException("Value " + value.getClass().getName() + " is not a "
                        + valueType.getName());
            }
            // The factory may have declared other values through this lock
            if (valuesById.containsKey(id)) {
                throw new DuplicateIdentifierException(name, id);
            }

            // Bounds first, so a reader holding the value never sees a stale minId
            nextId = id + 1;
            if (nextId > topId) {
                topId = nextId;
            }
            if (id < bottomId) {
                bottomId = id;
            }
            if (usePreset) {
                presetNameIndex++;
            }
            valuesById.put(id, value);
            version++;
            log.debug("Declared {} #{} in enumeration {}", valueName != null ? valueName : "(unnamed)", id, name);
            return value;
        } finally {
            registrationLock.unlock();
        }
    }

    private void checkIdRange(int id) {
        if (id == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("id " + id + " leaves no room for the next id");
        }
        long bottom = Math.min(bottomId, id);
        long top = Math.max(topId, id + 1);
        if (top - bottom > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("id " + id + " widens the id range of enumeration "
                    + name + " beyond " + Integer.MAX_VALUE + " bits");
        }
    }

    // ------------------------------------------------------------------ lookup

    /**
     * The value with the given id.
     *
     * @throws UnknownIdentifierException if no value has that id
     */
    public V valueById(int id) {
        V value = valuesById.get(id);
        if (value == null) {
            throw new UnknownIdentifierException(name, id);
        }
        return value;
    }

    public Optional<V> findById(int id) {
        return Optional.ofNullable(valuesById.get(id));
    }

    /**
     * The value whose display name is {@code name}.
     *
     * @throws UnknownNameException if no value has that name
     */
    public V valueByName(String name) {
        return values().withName(name);
    }

    public Optional<V> findByName(String name) {
        return values().findByName(name);
    }

    /**
     * All values of this enumeration, in ascending id order.
     * <p>
     * A snapshot: values declared after the call are not included.
     */
    public ValueSet<V> values() {
        var current = snapshot;
        if (current != null && current.version() == version) {
            return current.values();
        }
        registrationLock.lock();
        try {
            current = snapshot;
            if (current != null && current.version() == version) {
                return current.values();
            }
            var bottom = bottomId;
            var builder = new IdBitSet.Builder();
            for (V value : valuesById.values()) {
                builder.set(value.id() - bottom);
            }
            var values = new ValueSet<>(this, bottom, builder.build());
            snapshot = new Snapshot<>(version, values);
            return values;
        } finally {
            registrationLock.unlock();
        }
    }

    /**
     * One more than the highest id ever assigned. With automatic ids starting at 0
     * this is the number of declared values.
     */
    public int maxId() {
        return topId;
    }

    /**
     * The lowest id ever assigned, but no higher than 0. Bit {@code k} of a
     * {@linkplain ValueSet#toBitMask() bitmask} stands for id {@code minId() + k}.
     */
    public int minId() {
        return bottomId;
    }

    /**
     * Number of declared values.
     */
    public int size() {
        return valuesById.size();
    }

    // ------------------------------------------------------------------ sets

    public ValueSet<V> emptySet() {
        return emptySet;
    }

    @SafeVarargs
    public final ValueSet<V> setOf(V... values) {
        var bottom = bottomId;
        var builder = new IdBitSet.Builder();
        for (V value : values) {
            checkOwned(value);
            builder.set(value.id() - bottom);
        }
        return new ValueSet<>(this, bottom, builder.build());
    }

    public ValueSet<V> copyOf(Iterable<? extends V> values) {
        if (values instanceof ValueSet<?> set && set.enumeration() == this) {
            @SuppressWarnings("unchecked")
            var same = (ValueSet<V>) set;
            return same;
        }
        var bottom = bottomId;
        var builder = new IdBitSet.Builder();
        for (V value : values) {
            checkOwned(value);
            builder.set(value.id() - bottom);
        }
        return new ValueSet<>(this, bottom, builder.build());
    }

    /**
     * Rebuild a set from a bitmask exported by {@link ValueSet#toBitMask()}.
     *
     * @throws UnknownIdentifierException if a set bit stands for an undeclared id
     */
    public ValueSet<V> fromBitMask(long[] bitMask) {
        Objects.requireNonNull(bitMask, "bitMask");
        var bottom = bottomId;
        var bits = IdBitSet.fromLongArray(bitMask);
        var e = bits.enumerator();
        while (e.hasNext()) {
            var id = bottom + e.nextInt();
            if (!valuesById.containsKey(id)) {
                throw new UnknownIdentifierException(name, id);
            }
        }
        return new ValueSet<>(this, bottom, bits);
    }

    /**
     * Ordering of values by id, the natural ordering of {@link EnumValue}.
     */
    public Comparator<V> ordering() {
        return Comparator.naturalOrder();
    }

    // ------------------------------------------------------------------ naming

    /**
     * Resolve the declared name of the value with the given id, populating the
     * name cache from the name source on a miss.
     *
     * @throws UnknownNameException if the name source does not name the value
     */
    String nameOf(int id) {
        var cached = namesById.get(id);
        if (cached != null) {
            return cached;
        }
        namesLock.lock();
        try {
            cached = namesById.get(id);
            if (cached == null) {
                populateNameMap();
                cached = namesById.get(id);
            }
        } finally {
            namesLock.unlock();
        }
        if (cached == null) {
            throw new UnknownNameException(name, "#" + id);
        }
        return cached;
    }

    private void populateNameMap() {
        var populated = 0;
        for (DeclaredName declared : nameSource.declaredNames(declaringClass, valueType)) {
            if (!(declared.value() instanceof EnumValue<?> value)) {
                continue;
            }
            if (value.enumeration() != this) {
                log.warn("Ignoring declared name '{}': value belongs to enumeration {}, not {}",
                        declared.name(), value.enumeration(), name);
                continue;
            }
            if (namesById.putIfAbsent(value.id(), declared.name()) == null) {
                populated++;
            }
        }
        log.debug("Populated {} declared names for enumeration {}", populated, name);
    }

    void checkOwned(EnumValue<?> value) {
        Objects.requireNonNull(value, "value");
        if (value.enumeration() != this) {
            throw new CrossRegistryOperationException(name, value.enumeration().name());
        }
    }

    // ------------------------------------------------------------------ identity

    public String name() {
        return name;
    }

    public Class<V> valueType() {
        return valueType;
    }

    public Class<?> declaringClass() {
        return declaringClass;
    }

    @Override
    public String toString() {
        return name;
    }

    private Object writeReplace() {
        return new SerializedEnumeration(declaringClass.getName(), name);
    }

    private void readObject(ObjectInputStream in) throws InvalidObjectException {
        throw new InvalidObjectException("Enumeration is restored through its serialized form");
    }

    private record Snapshot<V extends EnumValue<V>>(int version, ValueSet<V> values) {
    }
}
