package io.enumeris.testutil;

import io.enumeris.registry.EnumValue;
import io.enumeris.registry.Enumeration;
import io.enumeris.registry.Registration;

/**
 * Constant-specific behaviour through anonymous subclasses.
 */
public abstract class Operation extends EnumValue<Operation> {

    public static final Enumeration<Operation> OPERATIONS = Enumeration.of(Operation.class);

    public static final Operation PLUS = OPERATIONS.declare(r -> new Operation(r) {
        @Override
        public double eval(double x, double y) {
            return x + y;
        }
    });
    public static final Operation MINUS = OPERATIONS.declare(r -> new Operation(r) {
        @Override
        public double eval(double x, double y) {
            return x - y;
        }
    });
    public static final Operation TIMES = OPERATIONS.declare(r -> new Operation(r) {
        @Override
        public double eval(double x, double y) {
            return x * y;
        }
    });
    public static final Operation DIVIDE = OPERATIONS.declare(r -> new Operation(r) {
        @Override
        public double eval(double x, double y) {
            return x / y;
        }
    });

    private Operation(Registration<Operation> registration) {
        super(registration);
    }

    public abstract double eval(double x, double y);
}
