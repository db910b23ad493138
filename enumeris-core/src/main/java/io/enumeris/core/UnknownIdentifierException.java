package io.enumeris.core;

/**
 * Thrown when no value is registered under the requested id.
 */
public class UnknownIdentifierException extends EnumerisException {

    private final int id;

    public UnknownIdentifierException(String enumeration, int id) {
        super("No value with id " + id + " in enumeration " + enumeration);
        this.id = id;
    }

    public int id() {
        return id;
    }
}
