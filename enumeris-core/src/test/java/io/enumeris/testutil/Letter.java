package io.enumeris.testutil;

import io.enumeris.core.EnumerisConfiguration;
import io.enumeris.registry.EnumValue;
import io.enumeris.registry.Enumeration;
import io.enumeris.registry.Registration;

/**
 * Two enumerations sharing one value type and one declaring class.
 */
public final class Letter extends EnumValue<Letter> {

    public static final Enumeration<Letter> GREEK =
            Enumeration.of(Letter.class, EnumerisConfiguration.builder().name("Greek").build());
    public static final Enumeration<Letter> LATIN =
            Enumeration.of(Letter.class, EnumerisConfiguration.builder().name("Latin").build());

    public static final Letter ALPHA = GREEK.declare(Letter::new);
    public static final Letter BETA = GREEK.declare(Letter::new);

    public static final Letter A = LATIN.declare(Letter::new);
    public static final Letter B = LATIN.declare(Letter::new);

    private Letter(Registration<Letter> registration) {
        super(registration);
    }
}
