package com.example.triprisk_backend.route;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RouteProfile {
    DRIVING_CAR("driving-car"),
    DRIVING_HGV("driving-hgv"),
    CYCLING("cycling-regular"),
    WALKING("foot-walking");

    private final String value;

    RouteProfile(String value) {this.value = value;}

    @JsonValue
    public String value() {return value;}
}
