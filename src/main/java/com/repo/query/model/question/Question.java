package com.repo.query.model.question;

import com.repo.query.model.repo.Repo;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(
        name = "questions",
        indexes = @Index(name = "idx_questions_repository", columnList = "repository_id")
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Question {

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
            foreignKey = @ForeignKey(name = "fk_questions_repository"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Repo repository;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String questionText;

    @Column(columnDefinition = "TEXT")
    private String answerText;

    private Double confidenceScore;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    private List<SourceReference> sources = new ArrayList<>();

    @Column(length = 100)
    private String modelUsed;

    private Long processingTimeMs;

    private boolean degraded;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;
}
