package io.enumeris.registry;

/**
 * Constructs one value of an enumeration from the registration it is handed.
 * <p>
 * Usually a constructor reference: {@code DAYS.declare("Monday", Day::new)}.
 *
 * @param <V> value type
 */
@FunctionalInterface
public interface ValueFactory<V extends EnumValue<V>> {

    V create(Registration<V> registration);
}
