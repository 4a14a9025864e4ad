package com.example.triprisk_backend.web;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.calendar.DepartureAdvisor;
import com.example.triprisk_backend.calendar.DeparturePrediction;
import com.example.triprisk_backend.calendar.HistoricalPattern;
import com.example.triprisk_backend.calendar.HolidayCalendar;
import com.example.triprisk_backend.calendar.HolidayRecord;
import com.example.triprisk_backend.geo.Coordinate;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/traffic")
public class TrafficController {

    public record HolidayList(int year, List<HolidayRecord> holidays, int total) {}

    private final DepartureAdvisor advisor;
    private final TripProps props;

    public TrafficController(DepartureAdvisor advisor, TripProps props) {
        this.advisor = advisor;
        this.props = props;
    }

    // origin and destination are only validated; the flow model is national
    @GetMapping("/best-departure")
    public DeparturePrediction bestDeparture(@RequestParam double originLat,
                                             @RequestParam double originLon,
                                             @RequestParam double destLat,
                                             @RequestParam double destLon,
                                             @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                             @RequestParam(defaultValue = "300") double baseDurationMin) {
        new Coordinate(originLat, originLon);
        new Coordinate(destLat, destLon);
        return advisor.predictBestDeparture(date, baseDurationMin);
    }

    @GetMapping("/history")
    public HistoricalPattern history(@RequestParam double lat,
                                     @RequestParam double lon,
                                     @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return advisor.historicalPattern(new Coordinate(lat, lon), date);
    }

    @GetMapping("/holidays")
    public HolidayList holidays(@RequestParam(required = false) Integer year) {
        int y = year != null ? year : LocalDate.now(props.zone()).getYear();
        List<HolidayRecord> all = HolidayCalendar.holidaysOf(y);
        return new HolidayList(y, all, all.size());
    }
}
