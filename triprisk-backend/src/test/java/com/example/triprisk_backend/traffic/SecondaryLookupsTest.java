package com.example.triprisk_backend.traffic;

import com.example.triprisk_backend.TestProps;
import com.example.triprisk_backend.geo.BoundingBox;
import com.example.triprisk_backend.support.StubHttp;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SecondaryLookupsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void tollsFromNodesAndWayCenters() {
        StubHttp stub = new StubHttp().on("overpass.test", """
            {"elements": [
              {"type": "node", "id": 1, "lat": -23.3, "lon": -46.2, "tags": {"name": "Praça Jacareí", "operator": "CCR"}},
              {"type": "way", "id": 2, "center": {"lat": -23.1, "lon": -45.9}, "tags": {"ref": "P2"}},
              {"type": "way", "id": 3, "tags": {}}
            ]}
            """);
        OverpassClient overpass = new OverpassClient(stub.client(), TestProps.defaults());

        List<TollPoint> tolls = overpass.tollPoints(new BoundingBox(-23.5, -46.6, -22.9, -45.0)).block();

        assertEquals(2, tolls.size());
        assertEquals("Praça Jacareí", tolls.get(0).name());
        assertEquals("CCR", tolls.get(0).operator());
        assertEquals("P2", tolls.get(1).name());
        assertEquals(-45.9, tolls.get(1).lon());
    }

    @Test
    void signalCyclesAreStablePerOsmId() throws Exception {
        String json = """
            {"elements": [
              {"type": "node", "id": 987654, "lat": -23.55, "lon": -46.63, "tags": {"name": "Av. Paulista"}},
              {"type": "way", "id": 5}
            ]}
            """;
        List<TrafficSignalPoint> first = OverpassClient.parseSignals(mapper.readTree(json));
        List<TrafficSignalPoint> again = OverpassClient.parseSignals(mapper.readTree(json));

        assertEquals(1, first.size());
        TrafficSignalPoint s = first.get(0);
        assertEquals(s, again.get(0));
        assertTrue(s.greenDuration() >= 20 && s.greenDuration() <= 35);
        assertEquals(3, s.yellowDuration());
        assertTrue(s.redDuration() >= 15 && s.redDuration() <= 30);
    }

    @Test
    void incidentsNeedAKey() {
        StubHttp stub = new StubHttp();
        TomTomClient tomTom = new TomTomClient(stub.client(), TestProps.defaults());

        assertTrue(tomTom.incidents(new BoundingBox(-23.5, -46.6, -22.9, -45.0)).block().isEmpty());
        assertTrue(stub.requested().isEmpty());
    }

    @Test
    void incidentsTakeFirstCoordinateOfLines() {
        StubHttp stub = new StubHttp().on("/incidentDetails", """
            {"incidents": [
              {"geometry": {"type": "LineString", "coordinates": [[-46.5, -23.4], [-46.4, -23.3]]},
               "properties": {"iconCategory": 8, "magnitudeOfDelay": 3, "delay": 600,
                              "events": [{"description": "Closed"}]}},
              {"geometry": {"type": "Point", "coordinates": [-45.9, -23.1]},
               "properties": {"iconCategory": 1}}
            ]}
            """);
        TomTomClient tomTom = new TomTomClient(stub.client(), TestProps.withKeys("", "", "tt-key"));

        List<IncidentPoint> incidents = tomTom.incidents(new BoundingBox(-23.5, -46.6, -22.9, -45.0)).block();

        assertEquals(2, incidents.size());
        assertEquals(-23.4, incidents.get(0).lat());
        assertEquals(-46.5, incidents.get(0).lon());
        assertEquals("Closed", incidents.get(0).description());
        assertEquals(10.0, incidents.get(0).delayMinutes());
        assertEquals(-23.1, incidents.get(1).lat());
    }
}
