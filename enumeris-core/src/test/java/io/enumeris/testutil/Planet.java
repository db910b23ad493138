package io.enumeris.testutil;

import io.enumeris.registry.EnumValue;
import io.enumeris.registry.Enumeration;
import io.enumeris.registry.Registration;

public final class Planet extends EnumValue<Planet> {

    public static final double G = 6.67300E-11;

    public static final Enumeration<Planet> PLANETS = Enumeration.of(Planet.class);

    public static final Planet MERCURY = PLANETS.declare(r -> new Planet(r, 3.303e+23, 2.4397e6));
    public static final Planet VENUS = PLANETS.declare(r -> new Planet(r, 4.869e+24, 6.0518e6));
    public static final Planet EARTH = PLANETS.declare(r -> new Planet(r, 5.976e+24, 6.37814e6));
    public static final Planet MARS = PLANETS.declare(r -> new Planet(r, 6.421e+23, 3.3972e6));
    public static final Planet JUPITER = PLANETS.declare(r -> new Planet(r, 1.9e+27, 7.1492e7));
    public static final Planet SATURN = PLANETS.declare(r -> new Planet(r, 5.688e+26, 6.0268e7));
    public static final Planet URANUS = PLANETS.declare(r -> new Planet(r, 8.686e+25, 2.5559e7));
    public static final Planet NEPTUNE = PLANETS.declare(r -> new Planet(r, 1.024e+26, 2.4746e7));

    private final double mass;
    private final double radius;

    private Planet(Registration<Planet> registration, double mass, double radius) {
        super(registration);
        this.mass = mass;
        this.radius = radius;
    }

    public double mass() {
        return mass;
    }

    public double radius() {
        return radius;
    }

    public double surfaceGravity() {
        return G * mass / (radius * radius);
    }

    public double surfaceWeight(double otherMass) {
        return otherMass * surfaceGravity();
    }
}
