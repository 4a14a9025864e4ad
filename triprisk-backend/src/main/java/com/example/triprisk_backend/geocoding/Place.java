package com.example.triprisk_backend.geocoding;

import com.example.triprisk_backend.geo.Coordinate;

/** A geocoded city, e.g. name "Campinas", displayName "Campinas, São Paulo". */
public record Place(String name, String displayName, Coordinate coordinates, double importance) {}
