package io.enumeris.core;

/**
 * Thrown when a name lookup misses after the declared names have been populated.
 */
public class UnknownNameException extends EnumerisException {

    private final String name;

    public UnknownNameException(String enumeration, String name) {
        super("No value found for '" + name + "' in enumeration " + enumeration);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
