package io.enumeris.core;

import java.util.List;

/**
 * Supplies the declared names of an enumeration's values.
 * <p>
 * Consulted lazily, the first time a value without an explicit name is displayed
 * or looked up by name. Implementations may report values of other enumerations;
 * the caller discards anything it does not own.
 */
@FunctionalInterface
public interface NameSource {

    /**
     * Discover the declared names visible from the declaring class.
     *
     * @param declaringClass the class declaring the enumeration's constants
     * @param valueType      the value type of the enumeration
     * @return declared names in declaration order, never null
     */
    List<DeclaredName> declaredNames(Class<?> declaringClass, Class<?> valueType);

    /**
     * Name source backed by static fields of the declaring class.
     */
    static NameSource reflective() {
        return ReflectiveNameSource.INSTANCE;
    }

    /**
     * Name source that knows no names; every value must be named when declared.
     */
    static NameSource none() {
        return (declaringClass, valueType) -> List.of();
    }

    /**
     * Name source backed by names recorded by a declaration layer.
     */
    static NameSource of(List<DeclaredName> names) {
        var copy = List.copyOf(names);
        return (declaringClass, valueType) -> copy;
    }
}
