/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.tablebackup.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.tablebackup.annotation.Immutable;
import io.tablebackup.util.Strings;

/**
 * An immutable definition of a field that may appear within a {@link Configuration} instance.
 */
@Immutable
public final class Field {

    /**
     * A functional interface that accepts validation results.
     */
    @FunctionalInterface
    public interface ValidationOutput {
        /**
         * Accept a problem with the given value for the field.
         * @param field the field with the value; may not be null
         * @param value the value that is not valid
         * @param problemMessage the message describing the problem; may not be null
         */
        void accept(Field field, Object value, String problemMessage);
    }

    /**
     * A functional interface that can be used to validate field values.
     */
    @FunctionalInterface
    public interface Validator {

        /**
         * Validate the supplied value for the field, and report any problems to the designated consumer.
         *
         * @param config the configuration containing the field to be validated; may not be null
         * @param field the {@link Field} being validated; never null
         * @param problems the consumer to be called with each problem; never null
         * @return the number of problems that were found, or 0 if the value is valid
         */
        int validate(Configuration config, Field field, ValidationOutput problems);

        /**
         * Obtain a new {@link Validator} object that validates using this validator and the supplied validator.
         *
         * @param other the validation function to call after this
         * @return the new validator, or this validator if {@code other} is {@code null} or equal to {@code this}
         */
        default Validator and(Validator other) {
            if (other == null || other == this) {
                return this;
            }
            return (config, field, problems) -> validate(config, field, problems) + other.validate(config, field, problems);
        }
    }

    /**
     * Create an immutable {@link Field} instance with the given property name.
     * @param name the name of the field; may not be null
     * @return the field; never null
     */
    public static Field create(String name) {
        return new Field(name, null, null, null, null, null, null, null, false);
    }

    /**
     * Create an immutable {@link Field} instance with the given property name and display name.
     * @param name the name of the field; may not be null
     * @param displayName the display name of the field; may not be null
     * @return the field; never null
     */
    public static Field create(String name, String displayName) {
        return new Field(name, displayName, null, null, null, null, null, null, false);
    }

    /**
     * Create an immutable {@link Field} instance with the given property name, display name and description.
     * @param name the name of the field; may not be null
     * @param displayName the display name of the field; may not be null
     * @param description the description
     * @return the field; never null
     */
    public static Field create(String name, String displayName, String description) {
        return new Field(name, displayName, null, null, description, null, null, null, false);
    }

    /**
     * Add the definitions of the supplied fields to a Kafka {@link ConfigDef} under the given group.
     *
     * @param configDef the definition to add to; may not be null
     * @param groupName the name of the group
     * @param fields the fields to define
     * @return the same definition, for chaining
     */
    public static ConfigDef group(ConfigDef configDef, String groupName, Field... fields) {
        if (configDef != null) {
            int orderInGroup = 1;
            for (Field f : fields) {
                configDef.define(f.name(), f.type(), f.defaultValue(), null, f.importance(), f.description(),
                        groupName, orderInGroup++, f.width(), f.displayName(), Collections.emptyList(), null);
            }
        }
        return configDef;
    }

    private final String name;
    private final String displayName;
    private final String desc;
    private final Supplier<Object> defaultValueGenerator;
    private final Validator validator;
    private final Width width;
    private final Type type;
    private final Importance importance;
    private final boolean isRequired;

    private Field(String name, String displayName, Type type, Width width, String description, Importance importance,
                  Supplier<Object> defaultValueGenerator, Validator validator, boolean isRequired) {
        Objects.requireNonNull(name, "The field name is required");
        this.name = name;
        this.displayName = displayName;
        this.desc = description;
        this.defaultValueGenerator = defaultValueGenerator != null ? defaultValueGenerator : () -> null;
        this.validator = validator;
        this.type = type != null ? type : Type.STRING;
        this.width = width != null ? width : Width.NONE;
        this.importance = importance != null ? importance : Importance.MEDIUM;
        this.isRequired = isRequired;
    }

    public String name() {
        return name;
    }

    /**
     * Get the default value of the field.
     * @return the default value, or {@code null} if there is no default value
     */
    public Object defaultValue() {
        return defaultValueGenerator.get();
    }

    /**
     * Get the string representation of the default value of the field.
     * @return the default value, or {@code null} if there is no default value
     */
    public String defaultValueAsString() {
        Object defaultValue = defaultValue();
        return defaultValue != null ? defaultValue.toString() : null;
    }

    public String description() {
        return desc;
    }

    public String displayName() {
        return displayName;
    }

    public Width width() {
        return width;
    }

    public Type type() {
        return type;
    }

    public Importance importance() {
        return importance;
    }

    public Validator validator() {
        return validator;
    }

    public boolean isRequired() {
        return isRequired;
    }

    /**
     * Validate the supplied value for this field, and report any problems to the designated consumer.
     * @param config the field values keyed by their name; may not be null
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    public boolean validate(Configuration config, ValidationOutput problems) {
        Validator typeValidator = validatorForType(type);
        int errors = 0;
        if (typeValidator != null) {
            errors += typeValidator.validate(config, this, problems);
        }
        if (validator != null) {
            errors += validator.validate(config, this, problems);
        }
        return errors == 0;
    }

    public Field withDescription(String description) {
        return new Field(name, displayName, type, width, description, importance, defaultValueGenerator, validator, isRequired);
    }

    public Field withDisplayName(String displayName) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator, isRequired);
    }

    public Field withWidth(Width width) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator, isRequired);
    }

    public Field withType(Type type) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator, isRequired);
    }

    public Field withImportance(Importance importance) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator, isRequired);
    }

    /**
     * Create and return a new Field instance that is a copy of this field but has a {@link #withType(Type) type} of
     * {@link Type#STRING} and a validator that only accepts the values of the given {@link EnumeratedValue} enumeration.
     *
     * @param enumType the enumeration type for the field
     * @param defaultOption the default enumeration value; may be null
     * @return the new field; never null
     */
    public <T extends Enum<T> & EnumeratedValue> Field withEnum(Class<T> enumType, T defaultOption) {
        Field result = withType(Type.STRING).withValidation(new EnumValidator<>(enumType));
        return defaultOption != null ? result.withDefault(defaultOption.getValue()) : result;
    }

    public Field required() {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator, true)
                .withValidation(Field::isRequired);
    }

    public Field withDefault(String defaultValue) {
        return new Field(name, displayName, type, width, desc, importance, () -> defaultValue, validator, isRequired);
    }

    public Field withDefault(int defaultValue) {
        return new Field(name, displayName, type, width, desc, importance, () -> defaultValue, validator, isRequired);
    }

    /**
     * Create and return a new Field instance that is a copy of this field but that in addition to {@link #validator() existing
     * validation} the supplied validation function(s) are also used.
     *
     * @param validators the additional validation function(s); may be null
     * @return the new field; never null
     */
    public Field withValidation(Validator... validators) {
        Validator actualValidator = validator;
        for (Validator v : validators) {
            if (v != null) {
                actualValidator = v.and(actualValidator);
            }
        }
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, actualValidator, isRequired);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Field) {
            Field that = (Field) obj;
            return this.name().equals(that.name());
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }

    private static final class EnumValidator<T extends Enum<T> & EnumeratedValue> implements Validator {

        private final Set<String> literals;
        private final String literalsStr;

        EnumValidator(Class<T> enumType) {
            List<String> values = Arrays.stream(enumType.getEnumConstants())
                    .map(EnumeratedValue::getValue)
                    .map(String::toLowerCase)
                    .collect(Collectors.toList());
            this.literals = Set.copyOf(values);
            this.literalsStr = Strings.join(", ", values);
        }

        @Override
        public int validate(Configuration config, Field field, ValidationOutput problems) {
            String value = config.getString(field);
            if (value == null || !literals.contains(value.trim().toLowerCase())) {
                problems.accept(field, value, "Value must be one of " + literalsStr);
                return 1;
            }
            return 0;
        }
    }

    public static Validator validatorForType(Type type) {
        switch (type) {
            case INT:
                return Field::isInteger;
            default:
                return null;
        }
    }

    public static int isRequired(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value != null && value.trim().length() > 0) {
            return 0;
        }
        problems.accept(field, value, "A value is required");
        return 1;
    }

    public static int isOptional(Configuration config, Field field, ValidationOutput problems) {
        // optional fields are valid whether or not there is a value
        return 0;
    }

    public static int isInteger(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            problems.accept(field, value, "An integer is expected");
            return 1;
        }
        return 0;
    }

    public static int isPositiveInteger(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            parsed = 0;
        }
        if (parsed > 0) {
            return 0;
        }
        problems.accept(field, value, "A positive, non-zero integer value is expected");
        return 1;
    }
}
