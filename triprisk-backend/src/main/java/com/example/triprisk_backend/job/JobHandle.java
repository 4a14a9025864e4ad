package com.example.triprisk_backend.job;

import java.util.concurrent.CompletableFuture;

/** Id of a submitted job and the future that completes when its pipeline ends, either way. */
public record JobHandle(String jobId, CompletableFuture<Void> done) {}
