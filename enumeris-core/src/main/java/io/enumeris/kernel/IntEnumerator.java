package io.enumeris.kernel;

/**
 * Primitive iterator over int values, free of boxing.
 */
public interface IntEnumerator {

    boolean hasNext();

    /**
     * @return the next value
     * @throws java.util.NoSuchElementException if exhausted
     */
    int nextInt();
}
