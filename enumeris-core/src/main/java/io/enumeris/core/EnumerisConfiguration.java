package io.enumeris.core;

import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration for an enumeration.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * EnumerisConfiguration config = EnumerisConfiguration.builder()
 *     .initialId(1)
 *     .nameSource(NameSource.none())
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built, so one instance may be shared by
 * several enumerations.
 */
public final class EnumerisConfiguration {

    private static final EnumerisConfiguration DEFAULTS = builder().build();

    // Id allocation
    private final int initialId;

    // Naming
    private final NameSource nameSource;
    private final List<String> presetNames;
    private final String name;

    private EnumerisConfiguration(Builder builder) {
        this.initialId = builder.initialId;
        this.nameSource = builder.nameSource != null
                ? builder.nameSource
                : NameSource.reflective();
        this.presetNames = List.copyOf(builder.presetNames);
        this.name = builder.name;
    }

    /**
     * Create a new builder for EnumerisConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The configuration used when none is given.
     */
    public static EnumerisConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the id handed to the first value declared without an explicit id.
     *
     * @return the initial id (default 0)
     */
    public int initialId() {
        return initialId;
    }

    /**
     * Get the source of declared names for values declared without a name.
     *
     * @return the name source (default: reflective)
     */
    public NameSource nameSource() {
        return nameSource;
    }

    /**
     * Get the names handed out, in order, to values declared without a name.
     * Once exhausted, names are resolved through the name source.
     *
     * @return preset names (default: empty)
     */
    public List<String> presetNames() {
        return presetNames;
    }

    /**
     * Get the display name of the enumeration.
     *
     * @return the configured name, or null to use the declaring class's simple name
     */
    public String name() {
        return name;
    }

    /**
     * Builder for EnumerisConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private int initialId = 0;
        private NameSource nameSource;
        private List<String> presetNames = List.of();
        private String name;

        private Builder() {
        }

        /**
         * Set the id of the first automatically numbered value.
         *
         * @param initialId the initial id, may be negative
         * @return this builder for method chaining
         */
        public Builder initialId(int initialId) {
            this.initialId = initialId;
            return this;
        }

        /**
         * Set the source of declared names.
         *
         * @param nameSource the name source
         * @return this builder for method chaining
         */
        public Builder nameSource(NameSource nameSource) {
            this.nameSource = Objects.requireNonNull(nameSource, "nameSource");
            return this;
        }

        /**
         * Set the names consumed by values declared without a name.
         *
         * @param presetNames names in declaration order
         * @return this builder for method chaining
         */
        public Builder presetNames(String... presetNames) {
            this.presetNames = List.of(presetNames);
            return this;
        }

        /**
         * Set the display name of the enumeration.
         *
         * @param name the enumeration name
         * @return this builder for method chaining
         */
        public Builder name(String name) {
            if (name != null && name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            this.name = name;
            return this;
        }

        /**
         * Build the configuration.
         *
         * @return the immutable configuration
         */
        public EnumerisConfiguration build() {
            return new EnumerisConfiguration(this);
        }
    }
}
