package io.enumeris.core;

import java.util.Objects;

/**
 * A name under which a declaring class exposes a value.
 *
 * @param name  the declared name
 * @param value the object bound to that name, possibly owned by another enumeration
 */
public record DeclaredName(String name, Object value) {

    public DeclaredName {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
