package io.enumeris.registry;

import io.enumeris.core.UnknownIdentifierException;

import java.io.InvalidObjectException;
import java.io.ObjectStreamException;
import java.io.Serializable;

/**
 * Serialized form of a {@link ValueSet}: the enumeration and the exported bitmask.
 */
final class SerializedValueSet implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Enumeration<?> enumeration;
    private final long[] bitMask;

    SerializedValueSet(Enumeration<?> enumeration, long[] bitMask) {
        this.enumeration = enumeration;
        this.bitMask = bitMask;
    }

    private Object readResolve() throws ObjectStreamException {
        try {
            return enumeration.fromBitMask(bitMask);
        } catch (UnknownIdentifierException e) {
            var failure = new InvalidObjectException(e.getMessage());
            failure.initCause(e);
            throw failure;
        }
    }
}
