package com.example.triprisk_backend.job;

import com.example.triprisk_backend.route.RouteGeometry;
import com.example.triprisk_backend.traffic.CongestionSegment;
import com.example.triprisk_backend.traffic.IncidentPoint;
import com.example.triprisk_backend.traffic.TollPoint;
import com.example.triprisk_backend.traffic.TrafficSample;
import com.example.triprisk_backend.traffic.TrafficSignalPoint;
import com.example.triprisk_backend.traffic.TrafficSummary;

import java.util.List;

/** Everything a completed job produced. */
public record TripResult(
    RouteGeometry routeGeometry,
    RouteSummary summary,
    List<WeatherSample> samples,
    List<RouteSegment> segments,
    TrafficSummary trafficSummary,
    List<TrafficSample> trafficSamples,
    List<TollPoint> tolls,
    List<IncidentPoint> incidents,
    List<CongestionSegment> congestionSegments,
    List<TrafficSignalPoint> trafficSignals
) {}
