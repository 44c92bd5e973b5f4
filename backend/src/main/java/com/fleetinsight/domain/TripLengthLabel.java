package com.fleetinsight.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Trip category by duration.
 */
public enum TripLengthLabel {
    SHORT("Short"),
    MEDIUM("Medium"),
    LONG("Long");

    private final String label;

    TripLengthLabel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<TripLengthLabel> fromLabel(String text) {
        return Labels.match(values(), text, TripLengthLabel::label);
    }
}
