package org.sysmlite.engine.validation;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Selection of validation checks to run: all, none or a named subset.
 */
public final class ValidationChecks {

    public static final ValidationChecks ALL = new ValidationChecks(null);
    public static final ValidationChecks NONE = new ValidationChecks(Set.of());

    // null means all
    private final Set<String> names;

    private ValidationChecks(Set<String> names) {
        this.names = names;
    }

    /**
     * @throws IllegalArgumentException if a name is not a known check
     */
    public static ValidationChecks of(String... names) {
        Set<String> selected = new LinkedHashSet<>();
        for (String name : names) {
            if (!ModelValidator.CHECK_NAMES.contains(name)) {
                throw new IllegalArgumentException("Unknown validation check: " + name);
            }
            selected.add(name);
        }
        return new ValidationChecks(Collections.unmodifiableSet(selected));
    }

    /**
     * Parses {@code all}, {@code none} or a comma-separated list of check names.
     */
    public static ValidationChecks parse(String value) {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("all")) {
            return ALL;
        }
        if (trimmed.equalsIgnoreCase("none") || trimmed.isEmpty()) {
            return NONE;
        }
        return of(Arrays.stream(trimmed.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toArray(String[]::new));
    }

    public boolean isEnabled(String check) {
        return names == null || names.contains(check);
    }

    public boolean isNone() {
        return names != null && names.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ValidationChecks checks && Objects.equals(names, checks.names);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(names);
    }

    @Override
    public String toString() {
        if (names == null) {
            return "all";
        }
        return names.isEmpty() ? "none" : String.join(",", names);
    }
}
