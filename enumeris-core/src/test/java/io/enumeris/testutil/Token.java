package io.enumeris.testutil;

import io.enumeris.registry.EnumValue;
import io.enumeris.registry.Registration;

/**
 * Value type for enumerations built inside tests.
 */
public final class Token extends EnumValue<Token> {

    public Token(Registration<Token> registration) {
        super(registration);
    }
}
