package com.safepocket.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Direction {
    SPIKE("spike"),
    DROP("drop");

    private final String label;

    Direction(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Direction of(double value, double mean) {
        return value > mean ? SPIKE : DROP;
    }
}
