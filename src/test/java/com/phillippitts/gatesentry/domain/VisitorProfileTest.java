package com.phillippitts.gatesentry.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VisitorProfileTest {

    @Test
    void startsWithEveryFieldUnset() {
        VisitorProfile profile = new VisitorProfile();

        assertThat(profile.fields().values()).containsOnly(FieldValue.unset());
        assertThat(profile.isComplete()).isFalse();
    }

    @Test
    void concreteValueIsNeverOverwritten() {
        VisitorProfile profile = new VisitorProfile();
        profile.offer(ProfileField.NAME, FieldValue.of("Bob Jones"));

        assertThat(profile.offer(ProfileField.NAME, FieldValue.of("Robert"))).isFalse();
        assertThat(profile.offer(ProfileField.NAME, FieldValue.unknown())).isFalse();
        assertThat(profile.get(ProfileField.NAME)).isEqualTo(FieldValue.of("Bob Jones"));
    }

    @Test
    void unknownCanBeUpgradedToValue() {
        VisitorProfile profile = new VisitorProfile();
        profile.offer(ProfileField.PURPOSE, FieldValue.unknown());

        assertThat(profile.offer(ProfileField.PURPOSE, FieldValue.of("meeting"))).isTrue();
        assertThat(profile.get(ProfileField.PURPOSE).value()).contains("meeting");
    }

    @Test
    void completeOnlyWhenAllFiveFieldsHoldValues() {
        VisitorProfile profile = new VisitorProfile();
        profile.offer(ProfileField.NAME, FieldValue.of("Bob Jones"));
        profile.offer(ProfileField.PURPOSE, FieldValue.of("meeting"));
        profile.offer(ProfileField.CONTACT_PERSON, FieldValue.of("David Smith"));
        profile.offer(ProfileField.THREAT_LEVEL, FieldValue.of("low"));
        profile.offer(ProfileField.AFFILIATION, FieldValue.unknown());

        assertThat(profile.isComplete()).isFalse();

        profile.offer(ProfileField.AFFILIATION, FieldValue.of("Acme"));

        assertThat(profile.isComplete()).isTrue();
    }

    @Test
    void resetClearsFieldsAndFlags() {
        VisitorProfile profile = new VisitorProfile();
        profile.offer(ProfileField.NAME, FieldValue.of("Bob Jones"));
        profile.setAuthenticated(true);
        profile.setIdVerified(true);

        profile.reset();

        assertThat(profile.get(ProfileField.NAME)).isEqualTo(FieldValue.unset());
        assertThat(profile.isAuthenticated()).isFalse();
        assertThat(profile.isIdVerified()).isFalse();
    }

    @Test
    void copyIsIndependent() {
        VisitorProfile profile = new VisitorProfile();
        VisitorProfile copy = profile.copy();

        copy.offer(ProfileField.NAME, FieldValue.of("Bob Jones"));

        assertThat(profile.get(ProfileField.NAME)).isEqualTo(FieldValue.unset());
    }
}
