package com.phillippitts.gatesentry.domain;

/**
 * Tracked visitor profile fields, declared in the order questions are asked.
 */
public enum ProfileField {
    NAME("name"),
    PURPOSE("purpose"),
    CONTACT_PERSON("contact_person"),
    THREAT_LEVEL("threat_level"),
    AFFILIATION("affiliation");

    private final String key;

    ProfileField(String key) {
        this.key = key;
    }

    /** Wire/log key of the field. */
    public String key() {
        return key;
    }
}
