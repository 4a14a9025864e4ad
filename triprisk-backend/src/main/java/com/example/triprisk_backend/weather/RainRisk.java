package com.example.triprisk_backend.weather;

import com.fasterxml.jackson.annotation.JsonValue;

/** Declared in ascending severity. */
public enum RainRisk {
    NONE("none", "Smooth trip, no significant rain expected."),
    LOW("low", "Low chance of rain. The trip should be calm."),
    MODERATE("moderate", "Moderate rain on some stretches. Stay alert."),
    HIGH("high", "High chance of rain. Drive carefully."),
    VERY_HIGH("very_high", "Heavy rain expected. Consider postponing the trip.");

    private final String value;
    private final String recommendation;

    RainRisk(String value, String recommendation) {
        this.value = value;
        this.recommendation = recommendation;
    }

    @JsonValue
    public String value() {return value;}

    public String recommendation() {return recommendation;}

    public static RainRisk classify(int precipProbability, double precipMm) {
        if (precipProbability < 20) return NONE;
        if (precipProbability < 40) return LOW;
        if (precipProbability < 60) return MODERATE;
        if (precipProbability < 80 && precipMm < 5) return HIGH;
        return VERY_HIGH;
    }

    public static RainRisk worst(RainRisk a, RainRisk b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
