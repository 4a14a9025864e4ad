package com.example.triprisk_backend.job;

import com.example.triprisk_backend.geo.Coordinate;
import com.example.triprisk_backend.geo.GeoMath;
import com.example.triprisk_backend.geo.MetroAreas;
import com.example.triprisk_backend.geo.SamplePoint;
import com.example.triprisk_backend.route.RouteGeometry;
import com.example.triprisk_backend.traffic.CongestionSegment;
import com.example.triprisk_backend.traffic.IncidentPoint;
import com.example.triprisk_backend.traffic.TollPoint;
import com.example.triprisk_backend.traffic.TrafficReport;
import com.example.triprisk_backend.traffic.TrafficSignalPoint;
import com.example.triprisk_backend.weather.FogRisk;
import com.example.triprisk_backend.weather.Forecast;
import com.example.triprisk_backend.weather.RainRisk;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Turns the raw pipeline outputs into the job payload. Stateless. */
public final class TripReportAssembler {

    static final int RAIN_SAMPLE_THRESHOLD = 20;
    static final double AUTHORITATIVE_CONFIDENCE = 0.9;
    static final double SYNTHETIC_CONFIDENCE = 0.5;

    // minutes lost to traffic lights per km driven
    static final double URBAN_SIGNAL_MIN_PER_KM = 0.625;
    static final double RURAL_SIGNAL_MIN_PER_KM = 0.04;

    private TripReportAssembler() {}

    public static WeatherSample weatherSample(SamplePoint p, int total, Forecast f) {
        return new WeatherSample(
            p.lat(), p.lon(), p.eta(),
            f.precipMm(), f.precipProbability(),
            f.temperatureC(), f.windSpeedKmh(), f.humidityPercent(), f.visibilityM(),
            f.fogRisk() == null ? FogRisk.NONE : f.fogRisk(),
            f.rainRisk(),
            f.source(),
            label(p.index(), total, p.progress()));
    }

    static String label(int index, int total, double progress) {
        if (index == 0) return "departure";
        if (index == total - 1) return "arrival";
        return (int) (progress * 100) + "%";
    }

    /** Splits the samples into maximal same-risk runs, walking them by position. */
    public static List<RouteSegment> segments(List<WeatherSample> samples) {
        List<RouteSegment> out = new ArrayList<>();
        if (samples.isEmpty()) return out;

        int start = 0;
        for (int i = 1; i <= samples.size(); i++) {
            if (i == samples.size() || samples.get(i).rainRisk() != samples.get(start).rainRisk()) {
                out.add(segment(samples, start, i - 1));
                start = i;
            }
        }
        return out;
    }

    private static RouteSegment segment(List<WeatherSample> samples, int first, int last) {
        WeatherSample a = samples.get(first);
        WeatherSample b = samples.get(last);
        RainRisk risk = a.rainRisk();
        return new RouteSegment(
            new Coordinate(a.lat(), a.lon()),
            new Coordinate(b.lat(), b.lon()),
            risk != RainRisk.NONE,
            risk,
            last - first + 1);
    }

    public static RouteSummary summary(RouteGeometry route, List<SamplePoint> points,
                                       List<WeatherSample> samples, Set<String> authoritativeSources) {
        RainRisk overall = RainRisk.NONE;
        FogRisk fog = FogRisk.NONE;
        int rainy = 0;
        Set<String> sources = new LinkedHashSet<>();
        for (WeatherSample s : samples) {
            overall = RainRisk.worst(overall, s.rainRisk());
            fog = FogRisk.worst(fog, s.fogRisk());
            if (s.precipProb() > RAIN_SAMPLE_THRESHOLD) rainy++;
            sources.add(s.source());
        }
        boolean authoritative = sources.stream().anyMatch(authoritativeSources::contains);

        return new RouteSummary(
            route.distanceKm(),
            route.durationMin(),
            samples.size(),
            rainy,
            overall,
            fog,
            overall.recommendation(),
            authoritative ? AUTHORITATIVE_CONFIDENCE : SYNTHETIC_CONFIDENCE,
            List.copyOf(sources),
            signalDelayMinutes(route.distanceKm(), points));
    }

    /**
     * Distance is split into urban and rural kilometres by the share of sample points
     * close to a metropolitan area.
     */
    static double signalDelayMinutes(double distanceKm, List<SamplePoint> points) {
        if (points.isEmpty() || distanceKm <= 0) return 0.0;
        long urban = points.stream().filter(p -> MetroAreas.isUrban(p.lat(), p.lon())).count();
        double urbanShare = (double) urban / points.size();
        double urbanKm = distanceKm * urbanShare;
        double ruralKm = distanceKm - urbanKm;
        return GeoMath.round(urbanKm * URBAN_SIGNAL_MIN_PER_KM + ruralKm * RURAL_SIGNAL_MIN_PER_KM, 1);
    }

    public static TripResult assemble(RouteGeometry route,
                                      List<SamplePoint> points,
                                      List<WeatherSample> samples,
                                      Set<String> authoritativeSources,
                                      TrafficReport traffic,
                                      List<TollPoint> tolls,
                                      List<IncidentPoint> incidents,
                                      List<CongestionSegment> congestion,
                                      List<TrafficSignalPoint> signals) {
        return new TripResult(
            route,
            summary(route, points, samples, authoritativeSources),
            List.copyOf(samples),
            segments(samples),
            traffic.summary(),
            traffic.samples(),
            List.copyOf(tolls),
            List.copyOf(incidents),
            List.copyOf(congestion),
            List.copyOf(signals));
    }
}
