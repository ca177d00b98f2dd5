package com.repo.query.model.job;

import com.repo.query.model.repo.Repo;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

@Entity
@Table(
        name = "analysis_jobs",
        indexes = @Index(name = "idx_analysis_jobs_repository", columnList = "repository_id")
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "repository_id", nullable = false)
    private Long repositoryId;

    //  mapped for the foreign key only; rows go when their repository goes
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "repository_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_analysis_jobs_repository"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Repo repository;

    //  queued -> processing -> completed | failed
    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private JobStatus status = JobStatus.QUEUED;

    private String taskId;

    @Builder.Default
    private int progressPercentage = 0;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    private Instant startedAt;

    private Instant completedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    public void start() {
        this.status = JobStatus.PROCESSING;
        this.progressPercentage = 0;
        this.errorMessage = null;
        this.startedAt = Instant.now();
    }

    /**
     * records a checkpoint; progress never moves backwards within a run
     *
     * @param percentage
     */
    public void advanceTo(int percentage) {
        if (percentage < 0 || percentage > 100)
            throw new IllegalArgumentException("Progress must be within [0, 100]: " + percentage);
        this.progressPercentage = Math.max(this.progressPercentage, percentage);
    }

    public void complete() {
        advanceTo(100);
        this.status = JobStatus.COMPLETED;
        this.completedAt = Instant.now();
    }

    public void fail(String errorMessage) {
        this.status = JobStatus.FAILED;
        this.errorMessage = errorMessage;
        this.completedAt = Instant.now();
    }
}
