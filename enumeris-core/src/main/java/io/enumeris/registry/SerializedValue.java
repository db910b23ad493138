package io.enumeris.registry;

import io.enumeris.core.UnknownIdentifierException;

import java.io.InvalidObjectException;
import java.io.ObjectStreamException;
import java.io.Serializable;

/**
 * Serialized form of an {@link EnumValue}: the enumeration and the id.
 * Resolves to the canonical instance, never to a copy.
 */
final class SerializedValue implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Enumeration<?> enumeration;
    private final int id;

    SerializedValue(Enumeration<?> enumeration, int id) {
        this.enumeration = enumeration;
        this.id = id;
    }

    private Object readResolve() throws ObjectStreamException {
        try {
            return enumeration.valueById(id);
        } catch (UnknownIdentifierException e) {
            var failure = new InvalidObjectException(e.getMessage());
            failure.initCause(e);
            throw failure;
        }
    }
}
