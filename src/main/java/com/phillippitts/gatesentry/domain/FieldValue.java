package com.phillippitts.gatesentry.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Three-valued profile slot: never attempted, attempted without a usable answer, or a concrete value.
 *
 * <p>Instances are immutable. {@link #unset()} and {@link #unknown()} are shared singletons.
 */
public final class FieldValue {

    public enum State { UNSET, UNKNOWN, VALUE }

    private static final FieldValue UNSET = new FieldValue(State.UNSET, null);
    private static final FieldValue UNKNOWN = new FieldValue(State.UNKNOWN, null);

    private final State state;
    private final String value;

    private FieldValue(State state, String value) {
        this.state = state;
        this.value = value;
    }

    public static FieldValue unset() {
        return UNSET;
    }

    public static FieldValue unknown() {
        return UNKNOWN;
    }

    /**
     * Creates a concrete value.
     *
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static FieldValue of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("FieldValue must not be blank");
        }
        return new FieldValue(State.VALUE, value);
    }

    public State state() {
        return state;
    }

    public boolean isValue() {
        return state == State.VALUE;
    }

    /** True while extraction may still be attempted (UNSET or UNKNOWN). */
    public boolean isMissing() {
        return state != State.VALUE;
    }

    public Optional<String> value() {
        return Optional.ofNullable(value);
    }

    /** Returns the concrete value or the given fallback. */
    public String orElse(String fallback) {
        return value != null ? value : fallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldValue other)) {
            return false;
        }
        return state == other.state && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value);
    }

    @Override
    public String toString() {
        return switch (state) {
            case UNSET -> "<unset>";
            case UNKNOWN -> "<unknown>";
            case VALUE -> value;
        };
    }
}
