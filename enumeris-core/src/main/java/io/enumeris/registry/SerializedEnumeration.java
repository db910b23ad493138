package io.enumeris.registry;

import java.io.InvalidObjectException;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * Serialized form of an {@link Enumeration}: its declaring class and name.
 * <p>
 * Resolves to the enumeration held in a static field of the declaring class
 * (or one of its superclasses) with the same name. Loading the class runs its
 * static initializer, which declares the values.
 */
final class SerializedEnumeration implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String declaringClassName;
    private final String name;

    SerializedEnumeration(String declaringClassName, String name) {
        this.declaringClassName = declaringClassName;
        this.name = name;
    }

    private Object readResolve() throws ObjectStreamException {
        var declaringClass = loadDeclaringClass();
        for (Class<?> type = declaringClass; type != null && type != Object.class; type = type.getSuperclass()) {
            for (Field field : type.getDeclaredFields()) {
                if (!Modifier.isStatic(field.getModifiers()) || !Enumeration.class.isAssignableFrom(field.getType())) {
                    continue;
                }
                if (!field.trySetAccessible()) {
                    continue;
                }
                var candidate = read(field);
                if (candidate instanceof Enumeration<?> enumeration && enumeration.name().equals(name)) {
                    return enumeration;
                }
            }
        }
        throw new InvalidObjectException("No enumeration named " + name + " declared in " + declaringClassName);
    }

    private Class<?> loadDeclaringClass() throws InvalidObjectException {
        var loader = Thread.currentThread().getContextClassLoader();
        try {
            return Class.forName(declaringClassName, true,
                    loader != null ? loader : SerializedEnumeration.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            var failure = new InvalidObjectException("Declaring class not found: " + declaringClassName);
            failure.initCause(e);
            throw failure;
        }
    }

    private static Object read(Field field) throws InvalidObjectException {
        try {
            return field.get(null);
        } catch (IllegalAccessException e) {
            var failure = new InvalidObjectException("Cannot read " + field);
            failure.initCause(e);
            throw failure;
        }
    }
}
