package com.fleetinsight.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Movement activity derived from instantaneous speed.
 */
public enum ActivityLabel {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    ActivityLabel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<ActivityLabel> fromLabel(String text) {
        return Labels.match(values(), text, ActivityLabel::label);
    }
}
