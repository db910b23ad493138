package io.enumeris.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Discovers value names from the static fields of a declaring class.
 * <p>
 * Walks the declaring class and its superclasses. A field qualifies when it is
 * static, not synthetic, and its declared type is assignable to the value type.
 * Fields still null (class initialization in progress) are skipped, so a later
 * lookup can pick them up. A field hidden by a subclass field of the same name
 * is ignored.
 */
public final class ReflectiveNameSource implements NameSource {

    private static final Logger log = LoggerFactory.getLogger(ReflectiveNameSource.class);

    static final ReflectiveNameSource INSTANCE = new ReflectiveNameSource();

    private ReflectiveNameSource() {
    }

    @Override
    public List<DeclaredName> declaredNames(Class<?> declaringClass, Class<?> valueType) {
        var result = new ArrayList<DeclaredName>();
        Set<String> seen = new HashSet<>();
        for (Class<?> type = declaringClass; type != null && type != Object.class; type = type.getSuperclass()) {
            for (Field field : type.getDeclaredFields()) {
                if (!isCandidate(field, valueType) || !seen.add(field.getName())) {
                    continue;
                }
                if (!field.trySetAccessible()) {
                    log.debug("Skipping inaccessible field {}.{}", type.getName(), field.getName());
                    continue;
                }
                Object value = read(field);
                if (value != null) {
                    result.add(new DeclaredName(field.getName(), value));
                }
            }
        }
        return result;
    }

    private static boolean isCandidate(Field field, Class<?> valueType) {
        return Modifier.isStatic(field.getModifiers())
                && !field.isSynthetic()
                && valueType.isAssignableFrom(field.getType());
    }

    private static Object read(Field field) {
        try {
            return field.get(null);
        } catch (IllegalAccessException e) {
            throw new EnumerisException("Failed to read field " + field.getDeclaringClass().getName()
                    + "." + field.getName(), e);
        }
    }
}
