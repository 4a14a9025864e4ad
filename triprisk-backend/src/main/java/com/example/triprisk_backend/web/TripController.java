package com.example.triprisk_backend.web;

import com.example.triprisk_backend.TripProps;
import com.example.triprisk_backend.geo.Coordinate;
import com.example.triprisk_backend.job.JobHandle;
import com.example.triprisk_backend.job.JobOrchestrator;
import com.example.triprisk_backend.job.JobStatus;
import com.example.triprisk_backend.job.JobStore;
import com.example.triprisk_backend.job.JobView;
import com.example.triprisk_backend.job.TripRequest;
import com.example.triprisk_backend.route.RouteProfile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

@RestController
@RequestMapping("/api/trips")
public class TripController {

    /** @param departureTime ISO date-time; without an offset it is read in the service timezone */
    public record TripRequestBody(Coordinate origin, Coordinate destination, String departureTime, RouteProfile profile) {}

    public record TripAccepted(String jobId, JobStatus status) {}

    private final JobOrchestrator orchestrator;
    private final JobStore store;
    private final TripProps props;

    public TripController(JobOrchestrator orchestrator, JobStore store, TripProps props) {
        this.orchestrator = orchestrator;
        this.store = store;
        this.props = props;
    }

    @PostMapping
    public ResponseEntity<TripAccepted> submit(@RequestBody TripRequestBody body) {
        TripRequest request = new TripRequest(body.origin(), body.destination(), departure(body.departureTime()), body.profile());
        JobHandle handle = orchestrator.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TripAccepted(handle.jobId(), JobStatus.PENDING));
    }

    @GetMapping("/{id}")
    public JobView status(@PathVariable String id) {
        return store.find(id)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job '" + id + "' not found"));
    }

    OffsetDateTime departure(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return OffsetDateTime.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(raw).atZone(props.zone()).toOffsetDateTime();
            } catch (DateTimeParseException e2) {
                throw new IllegalArgumentException("departureTime is not an ISO date-time: " + raw, e2);
            }
        }
    }
}
