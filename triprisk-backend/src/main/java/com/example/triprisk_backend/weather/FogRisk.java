package com.example.triprisk_backend.weather;

import com.fasterxml.jackson.annotation.JsonValue;

/** Declared in ascending severity. */
public enum FogRisk {
    NONE("none"),
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high");

    static final int ASSUMED_VISIBILITY_M = 10_000;

    private final String value;

    FogRisk(String value) {this.value = value;}

    @JsonValue
    public String value() {return value;}

    /**
     * WMO weather codes 40..49 (fog and mist) force HIGH; otherwise visibility decides.
     * A missing visibility reads as clear air.
     */
    public static FogRisk classify(Integer visibilityM, Integer weatherCode) {
        int code = weatherCode == null ? 0 : weatherCode;
        if (code >= 40 && code <= 49) return HIGH;
        int vis = visibilityM == null ? ASSUMED_VISIBILITY_M : visibilityM;
        if (vis < 1000) return HIGH;
        if (vis < 3000) return MODERATE;
        if (vis < 8000) return LOW;
        return NONE;
    }

    public static FogRisk worst(FogRisk a, FogRisk b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
