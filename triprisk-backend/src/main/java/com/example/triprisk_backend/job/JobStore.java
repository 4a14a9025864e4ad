package com.example.triprisk_backend.job;

import com.example.triprisk_backend.TripProps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job registry. Live jobs sit in a concurrent map; finished jobs are mirrored to the
 * database so polling keeps working across restarts. Both copies expire after the
 * retention window.
 */
@Component
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final JobSnapshotRepository repo;
    private final ObjectMapper json;
    private final Duration retention;
    private final Clock clock;

    @Autowired
    public JobStore(JobSnapshotRepository repo, ObjectMapper mapper, TripProps props) {
        this(repo, mapper, Duration.ofSeconds(props.jobs().retentionSeconds()), Clock.system(props.zone()));
    }

    public JobStore(JobSnapshotRepository repo, ObjectMapper mapper, Duration retention, Clock clock) {
        this.repo = repo;
        // keep the offsets the payload was written with
        this.json = mapper.copy().disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        this.retention = retention;
        this.clock = clock;
    }

    public Job create() {
        Job job = new Job(UUID.randomUUID().toString(), now());
        jobs.put(job.id(), job);
        log.info("Job {} created", job.id());
        return job;
    }

    /** In-memory first, then the durable mirror if its copy has not expired. */
    public Optional<JobView> find(String id) {
        Job live = jobs.get(id);
        if (live != null) return Optional.of(JobView.of(live));
        try {
            return repo.findById(id)
                .filter(s -> s.getExpiresAt().isAfter(now()))
                .flatMap(this::fromSnapshot);
        } catch (DataAccessException e) {
            log.warn("Snapshot lookup failed for {}: {}", id, e.toString());
            return Optional.empty();
        }
    }

    public void markProcessing(String id) {
        require(id).markProcessing();
        log.info("Job {} processing", id);
    }

    public void complete(String id, TripResult result) {
        require(id).complete(result, now());
        log.info("Job {} completed: {} samples", id, result.samples().size());
    }

    public void fail(String id, String error) {
        require(id).fail(error, now());
        log.info("Job {} failed: {}", id, error);
    }

    /** Best effort: a failed write is logged and the job stays served from memory. */
    public Mono<Void> persist(String id) {
        Job job = jobs.get(id);
        if (job == null || !job.status().isTerminal()) return Mono.empty();
        return Mono.fromCallable(() -> repo.save(toSnapshot(job)))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(s -> log.debug("Job {} persisted until {}", id, s.getExpiresAt()))
            .onErrorResume(e -> {
                log.warn("Persisting job {} failed: {}", id, e.toString());
                return Mono.empty();
            })
            .then();
    }

    public boolean isConnected() {
        try {
            repo.count();
            return true;
        } catch (DataAccessException e) {
            log.warn("Job store unreachable: {}", e.toString());
            return false;
        }
    }

    public long activeJobs() {
        return jobs.values().stream().filter(j -> !j.status().isTerminal()).count();
    }

    @Scheduled(initialDelayString = "#{${trip.jobs.sweep-seconds} * 1000}",
               fixedDelayString = "#{${trip.jobs.sweep-seconds} * 1000}")
    public void sweep() {
        int evicted = sweepExpired();
        if (evicted > 0) log.info("Swept {} finished jobs from memory", evicted);
        try {
            long purged = repo.deleteByExpiresAtBefore(now());
            if (purged > 0) log.info("Purged {} expired job snapshots", purged);
        } catch (DataAccessException e) {
            log.warn("Snapshot purge failed: {}", e.toString());
        }
    }

    /** Drops terminal jobs that finished more than the retention window ago. */
    int sweepExpired() {
        OffsetDateTime cutoff = now().minus(retention);
        int before = jobs.size();
        jobs.values().removeIf(j -> j.status().isTerminal() && j.finishedAt() != null && j.finishedAt().isBefore(cutoff));
        return before - jobs.size();
    }

    private Job require(String id) {
        Job job = jobs.get(id);
        if (job == null) throw new IllegalArgumentException("Unknown job " + id);
        return job;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    JobSnapshot toSnapshot(Job job) throws JsonProcessingException {
        JobSnapshot s = new JobSnapshot();
        s.setId(job.id());
        s.setStatus(job.status().name());
        s.setError(job.error());
        s.setCreatedAt(job.createdAt());
        s.setFinishedAt(job.finishedAt());
        s.setExpiresAt(job.finishedAt().plus(retention));
        if (job.result() != null) s.setResultJson(json.writeValueAsString(job.result()));
        return s;
    }

    Optional<JobView> fromSnapshot(JobSnapshot s) {
        try {
            TripResult result = s.getResultJson() == null ? null : json.readValue(s.getResultJson(), TripResult.class);
            OffsetDateTime created = s.getCreatedAt().atZoneSameInstant(clock.getZone()).toOffsetDateTime();
            return Optional.of(new JobView(s.getId(), JobStatus.valueOf(s.getStatus()), s.getError(), created, result));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unreadable snapshot for job {}: {}", s.getId(), e.toString());
            return Optional.empty();
        }
    }
}
