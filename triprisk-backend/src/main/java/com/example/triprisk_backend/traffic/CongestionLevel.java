package com.example.triprisk_backend.traffic;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CongestionLevel {
    FREE("free", "#16a34a"),
    LIGHT("light", "#84cc16"),
    MODERATE("moderate", "#eab308"),
    HEAVY("heavy", "#f97316"),
    SEVERE("severe", "#dc2626");

    private final String value;
    private final String color;

    CongestionLevel(String value, String color) {
        this.value = value;
        this.color = color;
    }

    @JsonValue
    public String value() {return value;}

    /** Hex color used when painting route segments. */
    public String color() {return color;}

    public static CongestionLevel fromRatio(double ratio) {
        if (ratio < 0.15) return FREE;
        if (ratio < 0.35) return LIGHT;
        if (ratio < 0.55) return MODERATE;
        if (ratio < 0.75) return HEAVY;
        return SEVERE;
    }
}
