package io.enumeris.core;

/**
 * Thrown when values or value sets of two different enumerations are combined.
 */
public class CrossRegistryOperationException extends EnumerisException {

    public CrossRegistryOperationException(String expected, String actual) {
        super("Cannot combine values of enumeration " + actual + " with enumeration " + expected);
    }
}
