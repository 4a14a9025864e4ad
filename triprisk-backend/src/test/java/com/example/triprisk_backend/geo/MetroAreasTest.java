package com.example.triprisk_backend.geo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MetroAreasTest {

    @Test
    void proximityFactorShrinksWithDistance() {
        assertEquals(2.0, MetroAreas.proximityFactor(-23.55, -46.63));
        assertTrue(MetroAreas.isUrban(-23.55, -46.63));
        // middle of the Atlantic
        assertEquals(0.6, MetroAreas.proximityFactor(-30.0, -30.0));
        assertFalse(MetroAreas.isUrban(-30.0, -30.0));
    }
}
