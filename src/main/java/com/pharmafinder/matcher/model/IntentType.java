package com.pharmafinder.matcher.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IntentType {
    PHARMACY_SEARCH("pharmacy_search"),
    LOCATION_QUERY("location_query"),
    GENERAL("general");

    private final String wireName;

    IntentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves the wire name returned by the LLM; unknown values map to {@link #GENERAL}.
     */
    @JsonCreator
    public static IntentType fromWireName(String value) {
        if (value == null) {
            return GENERAL;
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (IntentType type : values()) {
            if (type.wireName.equals(key)) {
                return type;
            }
        }
        return GENERAL;
    }
}
