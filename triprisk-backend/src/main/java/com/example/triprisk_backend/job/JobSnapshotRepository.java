package com.example.triprisk_backend.job;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

public interface JobSnapshotRepository extends JpaRepository<JobSnapshot, String> {

    @Transactional
    long deleteByExpiresAtBefore(OffsetDateTime cutoff);
}
