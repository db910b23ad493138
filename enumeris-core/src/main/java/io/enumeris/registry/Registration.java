package io.enumeris.registry;

/**
 * Single-use ticket binding a value under construction to its id, name and
 * enumeration.
 * <p>
 * Issued by {@link Enumeration#declare} while the registration lock is held and
 * consumed by the {@link EnumValue} constructor. A ticket cannot be consumed
 * twice, and a value is only visible to lookups once the declaring call returns.
 *
 * @param <V> value type
 */
public final class Registration<V extends EnumValue<V>> {
    private final Enumeration<V> enumeration;
    private final int id;
    private final String name;
    private boolean claimed;

    Registration(Enumeration<V> enumeration, int id, String name) {
        this.enumeration = enumeration;
        this.id = id;
        this.name = name;
    }

    public int id() {
        return id;
    }

    /**
     * @return the explicit name, or null when the name is resolved lazily
     */
    public String name() {
        return name;
    }

    public Enumeration<V> enumeration() {
        return enumeration;
    }

    void claim() {
        if (claimed) {
            throw new IllegalStateException("Registration for id " + id + " in " + enumeration
                    + " was already used to construct a value");
        }
        claimed = true;
    }

    boolean isClaimed() {
        return claimed;
    }
}
