/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.config;

import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import io.tablebackup.annotation.Immutable;
import io.tablebackup.config.Field.ValidationOutput;

/**
 * An immutable representation of a table backup configuration. A {@link Configuration} instance can be obtained
 * {@link #from(Properties) from Properties} or {@link #from(Map) from a Map}, or built by first {@link #create() creating
 * a builder} and then using that builder to populate and {@link Builder#build() return} the immutable instance.
 * <p>
 * Values are stored as strings and converted on access, optionally falling back to the default value of the
 * {@link Field} being read.
 */
@Immutable
public interface Configuration {

    Pattern PASSWORD_PATTERN = Pattern.compile(".*password$", Pattern.CASE_INSENSITIVE);

    /**
     * The basic interface for configuration builders.
     *
     * @param <C> the type of configuration
     * @param <B> the type of builder
     */
    interface ConfigBuilder<C extends Configuration, B extends ConfigBuilder<C, B>> {
        /**
         * Associate the given value with the specified key.
         *
         * @param key the key
         * @param value the value
         * @return this builder object so methods can be chained together; never null
         */
        B with(String key, String value);

        /**
         * If there is no field with the specified key, then associate the given value with the specified key.
         *
         * @param key the key
         * @param value the value
         * @return this builder object so methods can be chained together; never null
         */
        B withDefault(String key, String value);

        default B with(String key, Object value) {
            return with(key, value != null ? value.toString() : null);
        }

        default B with(Field field, String value) {
            return with(field.name(), value);
        }

        default B with(Field field, Object value) {
            return with(field.name(), value);
        }

        default B with(Field field, int value) {
            return with(field.name(), Integer.toString(value));
        }

        default B with(Field field, EnumeratedValue value) {
            return with(field.name(), value != null ? value.getValue() : null);
        }

        default B withDefault(Field field, Object value) {
            return withDefault(field.name(), value != null ? value.toString() : null);
        }

        /**
         * Add all of the fields in the supplied Configuration object, overwriting existing values.
         *
         * @param other the configuration whose fields should be added; may be null
         * @return this builder object so methods can be chained together; never null
         */
        default B with(Configuration other) {
            @SuppressWarnings("unchecked")
            B self = (B) this;
            if (other != null) {
                other.keys().forEach(key -> with(key, other.getString(key)));
            }
            return self;
        }

        /**
         * Build and return the immutable configuration.
         *
         * @return the immutable configuration; never null
         */
        C build();
    }

    /**
     * A builder of Configuration objects.
     */
    class Builder implements ConfigBuilder<Configuration, Builder> {
        private final Properties props = new Properties();

        protected Builder() {
        }

        protected Builder(Properties props) {
            this.props.putAll(props);
        }

        @Override
        public Builder with(String key, String value) {
            if (value == null) {
                props.remove(key);
            }
            else {
                props.setProperty(key, value);
            }
            return this;
        }

        @Override
        public Builder withDefault(String key, String value) {
            if (!props.containsKey(key) && value != null) {
                props.setProperty(key, value);
            }
            return this;
        }

        @Override
        public Configuration build() {
            return Configuration.from(props);
        }
    }

    /**
     * Create a new {@link Builder configuration builder}.
     *
     * @return the configuration builder
     */
    static Builder create() {
        return new Builder();
    }

    /**
     * Create a new {@link Builder configuration builder} that starts with a copy of the supplied configuration.
     *
     * @param config the configuration to copy; may be null
     * @return the configuration builder
     */
    static Builder copy(Configuration config) {
        return config != null ? new Builder(config.asProperties()) : new Builder();
    }

    /**
     * Obtain an empty configuration.
     *
     * @return an empty configuration; never null
     */
    static Configuration empty() {
        return new Configuration() {
            @Override
            public Set<String> keys() {
                return Collections.emptySet();
            }

            @Override
            public String getString(String key) {
                return null;
            }

            @Override
            public String toString() {
                return "{}";
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied Properties object. The supplied {@link Properties} object is
     * copied so that the resulting Configuration cannot be modified.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Properties properties) {
        Properties props = new Properties();
        if (properties != null) {
            props.putAll(properties);
        }
        return new Configuration() {
            @Override
            public String getString(String key) {
                return props.getProperty(key);
            }

            @Override
            public Set<String> keys() {
                return props.stringPropertyNames();
            }

            @Override
            public String toString() {
                return withMaskedPasswords().toString();
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied map of string keys and object values. Null values are
     * dropped.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Map<String, ?> properties) {
        Properties props = new Properties();
        if (properties != null) {
            properties.forEach((key, value) -> {
                if (key != null && value != null) {
                    props.setProperty(key, value.toString());
                }
            });
        }
        return from(props);
    }

    /**
     * Obtain an editor for a copy of this configuration.
     *
     * @return a builder that is populated with this configuration's key-value pairs; never null
     */
    default Builder edit() {
        return copy(this);
    }

    /**
     * Determine whether this configuration contains a key-value pair with the given key and the value is non-null
     *
     * @param key the key
     * @return true if the configuration contains the key, or false otherwise
     */
    default boolean hasKey(String key) {
        return getString(key) != null;
    }

    /**
     * Get the set of keys in this configuration.
     *
     * @return the set of keys; never null but possibly empty
     */
    Set<String> keys();

    /**
     * Get the string value associated with the given key.
     *
     * @param key the key for the configuration property
     * @return the value, or null if the key is null or there is no such key-value pair in the configuration
     */
    String getString(String key);

    default String getString(String key, String defaultValue) {
        return getString(key, () -> defaultValue);
    }

    default String getString(String key, Supplier<String> defaultValueSupplier) {
        String value = getString(key);
        return value != null ? value : (defaultValueSupplier != null ? defaultValueSupplier.get() : null);
    }

    /**
     * Get the string value associated with the given field, returning the field's default value if there is no such key-value
     * pair in this configuration.
     *
     * @param field the field; may not be null
     * @return the configuration's value for the field, or the field's {@link Field#defaultValue() default value} if there is no
     *         such key-value pair in the configuration
     */
    default String getString(Field field) {
        return getString(field.name(), field.defaultValueAsString());
    }

    /**
     * Get the integer value associated with the given field, returning the field's default value if there is no such
     * key-value pair.
     *
     * @param field the field
     * @return the integer value
     * @throws NumberFormatException if neither the configured value nor the field's default value is an integer
     */
    default int getInteger(Field field) {
        String value = getString(field);
        return Integer.parseInt(value != null ? value.trim() : null);
    }

    /**
     * Return a new {@link Configuration} that contains only the key-value pairs whose keys start with the given prefix.
     *
     * @param prefix the prefix; may not be null
     * @param removePrefix true if the prefix is to be stripped from the keys of the subset
     * @return the subset of this configuration; never null
     */
    default Configuration subset(String prefix, boolean removePrefix) {
        Properties props = new Properties();
        keys().stream()
                .filter(key -> key.startsWith(prefix))
                .forEach(key -> {
                    String value = getString(key);
                    if (value != null) {
                        props.setProperty(removePrefix ? key.substring(prefix.length()) : key, value);
                    }
                });
        return from(props);
    }

    /**
     * Get a copy of these configuration properties as a Properties object.
     *
     * @return the properties object; never null
     */
    default Properties asProperties() {
        Properties props = new Properties();
        keys().forEach(key -> {
            String value = getString(key);
            if (key != null && value != null) {
                props.setProperty(key, value);
            }
        });
        return props;
    }

    /**
     * Return a copy of these properties in which the values of all password-like keys are replaced by asterisks.
     *
     * @return the masked properties; never null
     */
    default Properties withMaskedPasswords() {
        Properties props = asProperties();
        for (String key : props.stringPropertyNames()) {
            if (PASSWORD_PATTERN.matcher(key).matches()) {
                props.setProperty(key, "********");
            }
        }
        return props;
    }

    /**
     * Validate the supplied fields in this configuration. Extra fields not described by the supplied {@code fields} parameter
     * are not validated.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validate(Iterable<Field> fields, ValidationOutput problems) {
        boolean valid = true;
        for (Field field : fields) {
            if (!field.validate(this, problems)) {
                valid = false;
            }
        }
        return valid;
    }

    /**
     * Validate the supplied fields in this configuration, passing a human-readable message for each problem to the
     * supplied consumer. Values of password fields are never included in the messages.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        return validate(fields, (f, v, problem) -> {
            if (v == null) {
                problems.accept("The '" + f.name() + "' value is invalid: " + problem);
            }
            else {
                String valueStr = PASSWORD_PATTERN.matcher(f.name()).matches() ? "********" : "'" + v + "'";
                problems.accept("The '" + f.name() + "' value " + valueStr + " is invalid: " + problem);
            }
        });
    }
}
