package com.example.triprisk_backend.route;

import com.example.triprisk_backend.TestProps;
import com.example.triprisk_backend.geo.Coordinate;
import com.example.triprisk_backend.support.StubHttp;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.junit.jupiter.api.Assertions.*;

public class RouteGeometryProviderTest {

    private static final Coordinate SAO_PAULO = new Coordinate(-23.55, -46.63);
    private static final Coordinate RIO = new Coordinate(-22.91, -43.17);

    static final String OSRM_OK = """
        {"code": "Ok", "routes": [{
          "distance": 429876.4, "duration": 19830.0,
          "geometry": {"type": "LineString", "coordinates": [[-46.63, -23.55], [-45.88, -23.18], [-43.17, -22.91]]}
        }]}
        """;

    static final String ORS_OK = """
        {"type": "FeatureCollection", "features": [{
          "properties": {"summary": {"distance": 431000.0, "duration": 20100.0}},
          "geometry": {"type": "LineString", "coordinates": [[-46.63, -23.55], [-43.17, -22.91]]}
        }]}
        """;

    @Test
    void withoutKeyGoesStraightToOsrm() {
        StubHttp stub = new StubHttp().on("/route/v1/driving/", OSRM_OK);
        RouteGeometryProvider provider = new RouteGeometryProvider(stub.client(), TestProps.defaults());

        RouteGeometry route = provider.calculateRoute(SAO_PAULO, RIO, RouteProfile.DRIVING_CAR).block();

        assertEquals("osrm", route.engine());
        assertEquals(429.88, route.distanceKm());
        assertEquals(330.5, route.durationMin());
        assertEquals(3, route.coordinates().size());
        assertEquals(new Coordinate(-23.18, -45.88), route.coordinates().get(1));
        assertEquals(1, stub.requested().size());
        assertTrue(stub.requested().get(0).contains("-46.630000,-23.550000;-43.170000,-22.910000"));
    }

    @Test
    void orsIsPreferredWhenConfigured() {
        StubHttp stub = new StubHttp().on("/v2/directions/driving-car/geojson", ORS_OK).on("/route/v1/driving/", OSRM_OK);
        RouteGeometryProvider provider = new RouteGeometryProvider(stub.client(), TestProps.withKeys("ors-key", "", ""));

        RouteGeometry route = provider.calculateRoute(SAO_PAULO, RIO, RouteProfile.DRIVING_CAR).block();

        assertEquals("openrouteservice", route.engine());
        assertEquals(431.0, route.distanceKm());
        assertEquals(335.0, route.durationMin());
    }

    @Test
    void orsFailureFallsBackToOsrm() {
        StubHttp stub = new StubHttp()
            .on("/v2/directions/", HttpStatus.INTERNAL_SERVER_ERROR, "{}")
            .on("/route/v1/driving/", OSRM_OK);
        RouteGeometryProvider provider = new RouteGeometryProvider(stub.client(), TestProps.withKeys("ors-key", "", ""));

        assertEquals("osrm", provider.calculateRoute(SAO_PAULO, RIO, RouteProfile.DRIVING_CAR).block().engine());
    }

    @Test
    void bothEnginesFailing() {
        StubHttp stub = new StubHttp().on("/route/v1/driving/", """
            {"code": "NoRoute", "message": "Impossible route between points"}
            """);
        RouteGeometryProvider provider = new RouteGeometryProvider(stub.client(), TestProps.defaults());

        RouteUnavailableException e = assertThrows(RouteUnavailableException.class,
            () -> provider.calculateRoute(SAO_PAULO, RIO, RouteProfile.DRIVING_CAR).block());
        assertTrue(e.getMessage().contains("Impossible route"));
    }
}
