package com.repo.query.model.repo;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

//  only changed columns are written, so a rename and a running analysis never overwrite each other
@Entity
@DynamicUpdate
@Table(name = "repositories")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Repo {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true, columnDefinition = "TEXT")
    private String repoUrl;

    @Builder.Default
    @Column(nullable = false, length = 100)
    private String branch = "main";

    @Column(columnDefinition = "TEXT")
    private String description;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private RepoStatus status = RepoStatus.PENDING;

    @Builder.Default
    private int totalFiles = 0;

    @Builder.Default
    private long totalLines = 0;

    //  language tag -> number of discovered files
    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Integer> languages = new HashMap<>();

    private Instant analyzedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public void markReady(int totalFiles, long totalLines, Map<String, Integer> languages) {
        this.status = RepoStatus.READY;
        this.totalFiles = totalFiles;
        this.totalLines = totalLines;
        this.languages = new HashMap<>(languages);
        this.analyzedAt = Instant.now();
    }

    public void markFailed() {
        this.status = RepoStatus.FAILED;
    }
}
