package com.phillippitts.gatesentry.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable visitor profile owned by a single {@link SessionState}.
 *
 * <p>Invariant: once a field holds a concrete value it is never overwritten; only {@link #reset()}
 * clears it. {@link #offer(ProfileField, FieldValue)} silently refuses such writes.
 */
public final class VisitorProfile {

    private final EnumMap<ProfileField, FieldValue> fields = new EnumMap<>(ProfileField.class);
    private boolean idVerified;
    private boolean authenticated;

    public VisitorProfile() {
        reset();
    }

    /** Clears every field back to UNSET and drops verification flags. */
    public void reset() {
        for (ProfileField f : ProfileField.values()) {
            fields.put(f, FieldValue.unset());
        }
        idVerified = false;
        authenticated = false;
    }

    public FieldValue get(ProfileField field) {
        return fields.get(field);
    }

    /**
     * Writes a field unless it already holds a concrete value.
     *
     * @return {@code true} if the field was changed
     */
    public boolean offer(ProfileField field, FieldValue value) {
        Objects.requireNonNull(value, "value");
        FieldValue current = fields.get(field);
        if (current.isValue() || current.equals(value)) {
            return false;
        }
        fields.put(field, value);
        return true;
    }

    /** True iff all tracked fields hold concrete values. */
    public boolean isComplete() {
        for (FieldValue v : fields.values()) {
            if (!v.isValue()) {
                return false;
            }
        }
        return true;
    }

    public boolean isIdVerified() {
        return idVerified;
    }

    public void setIdVerified(boolean idVerified) {
        this.idVerified = idVerified;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public void setAuthenticated(boolean authenticated) {
        this.authenticated = authenticated;
    }

    public Map<ProfileField, FieldValue> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public VisitorProfile copy() {
        VisitorProfile c = new VisitorProfile();
        c.fields.putAll(fields);
        c.idVerified = idVerified;
        c.authenticated = authenticated;
        return c;
    }

    @Override
    public String toString() {
        return "VisitorProfile" + fields + "{idVerified=" + idVerified + ", authenticated=" + authenticated + '}';
    }
}
