package com.changesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Tag naming a class of root cause, e.g. {@code db-cpu} or {@code http-error}.
 *
 * <p>
 * The set is open: the constants below are the well-known categories, and
 * any other lowercase tag can be declared in configuration via
 * {@link #of(String)}. How categories relate to each other lives in
 * {@code CausationTable}, not here.
 * </p>
 *
 * @since 1.0.0
 */
public final class CausationCategory implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Pattern TAG_PATTERN = Pattern.compile("[a-z0-9][a-z0-9-]*");

    public static final CausationCategory DB_CPU = new CausationCategory("db-cpu");
    public static final CausationCategory DB_CONNECTIONS = new CausationCategory("db-connections");
    public static final CausationCategory CACHE_MEMORY = new CausationCategory("cache-memory");
    public static final CausationCategory HTTP_ERROR = new CausationCategory("http-error");
    public static final CausationCategory POD_RESOURCE = new CausationCategory("pod-resource");
    public static final CausationCategory DEPLOYMENT_GENERIC = new CausationCategory("deployment-generic");

    private final String name;

    private CausationCategory(String name) {
        this.name = name;
    }

    /**
     * Resolve a category tag.
     *
     * @param name tag, case-insensitive
     * @return the category
     * @throws IllegalArgumentException if {@code name} is blank or malformed
     */
    @JsonCreator
    public static CausationCategory of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("causation category is required");
        }
        String normalised = name.trim().toLowerCase(Locale.ROOT);
        if (!TAG_PATTERN.matcher(normalised).matches()) {
            throw new IllegalArgumentException("Malformed causation category: '" + name + "'");
        }
        return new CausationCategory(normalised);
    }

    @JsonValue
    public String name() {
        return name;
    }

    public boolean isGeneric() {
        return DEPLOYMENT_GENERIC.equals(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CausationCategory that))
            return false;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
