package io.enumeris.core;

/**
 * Thrown when a declaration asks for an id that is already taken in its enumeration.
 * The rejected declaration leaves the enumeration untouched.
 */
public class DuplicateIdentifierException extends EnumerisException {

    private final int id;

    public DuplicateIdentifierException(String enumeration, int id) {
        super("Duplicate id " + id + " in enumeration " + enumeration);
        this.id = id;
    }

    public int id() {
        return id;
    }
}
