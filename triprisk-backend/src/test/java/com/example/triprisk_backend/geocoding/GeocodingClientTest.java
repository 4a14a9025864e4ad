package com.example.triprisk_backend.geocoding;

import com.example.triprisk_backend.TestProps;
import com.example.triprisk_backend.support.StubHttp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GeocodingClientTest {

    private static final String CAMPINAS = """
        [
          {"lat": "-22.9056", "lon": "-47.0608", "display_name": "Campinas, Região Imediata de Campinas, São Paulo, Brasil",
           "importance": 0.62, "address": {"city": "Campinas", "state": "São Paulo"}},
          {"lat": "-22.9061", "lon": "-47.0612", "display_name": "Campinas, São Paulo",
           "importance": 0.40, "address": {"city": "Campinas", "state": "São Paulo"}},
          {"lat": "-16.6799", "lon": "-49.2550", "display_name": "Campinas, Goiânia, Goiás, Brasil",
           "importance": 0.71, "address": {"suburb": "Campinas", "state": "Goiás"}}
        ]
        """;

    @Test
    void deduplicatesNearbyHitsAndSortsByImportance() {
        StubHttp stub = new StubHttp().on("/search", CAMPINAS);
        GeocodingClient client = new GeocodingClient(stub.client(), TestProps.defaults());

        List<Place> places = client.search("Campinas", 5).block();

        assertEquals(2, places.size());
        assertEquals("Campinas, Goiás", places.get(0).displayName());
        assertEquals("Campinas, São Paulo", places.get(1).displayName());
        assertEquals(-22.9056, places.get(1).coordinates().lat());
    }

    @Test
    void shortQueriesAreNotSent() {
        StubHttp stub = new StubHttp();
        GeocodingClient client = new GeocodingClient(stub.client(), TestProps.defaults());

        assertTrue(client.search(" a ", 5).block().isEmpty());
        assertTrue(stub.requested().isEmpty());
    }
}
