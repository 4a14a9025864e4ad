package com.example.triprisk_backend.job;

import jakarta.persistence.*;
import java.time.OffsetDateTime;

@Entity
@Table(name = "job_snapshot")
public class JobSnapshot {
    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable=false, length = 16) private String status;

    @Column(columnDefinition = "text")
    private String error;

    @Column(columnDefinition = "text")
    private String resultJson;              // TripResult as JSON, null unless completed

    @Column(nullable=false) private OffsetDateTime createdAt;
    private OffsetDateTime finishedAt;

    @Column(nullable=false)
    private OffsetDateTime expiresAt;

    public String getId() {return id;}
    public void setId(String id) {this.id = id;}

    public String getStatus() {return status;}
    public void setStatus(String status) {this.status = status;}

    public String getError() {return error;}
    public void setError(String error) {this.error = error;}

    public String getResultJson() {return resultJson;}
    public void setResultJson(String resultJson) {this.resultJson = resultJson;}

    public OffsetDateTime getCreatedAt() {return createdAt;}
    public void setCreatedAt(OffsetDateTime createdAt) {this.createdAt = createdAt;}

    public OffsetDateTime getFinishedAt() {return finishedAt;}
    public void setFinishedAt(OffsetDateTime finishedAt) {this.finishedAt = finishedAt;}

    public OffsetDateTime getExpiresAt() {return expiresAt;}
    public void setExpiresAt(OffsetDateTime expiresAt) {this.expiresAt = expiresAt;}
}
