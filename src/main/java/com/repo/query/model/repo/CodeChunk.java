package com.repo.query.model.repo;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Entity
@Table(
        name = "code_chunks",
        indexes = @Index(name = "idx_code_chunks_repository", columnList = "repository_id")
)
@Check(name = "valid_lines", constraints = "line_start <= line_end")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeChunk {

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
            foreignKey = @ForeignKey(name = "fk_code_chunks_repository"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Repo repository;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String filePath;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String chunkText; // the actual code snippet

    @Enumerated(EnumType.STRING)
    @Column(length = 50)
    private ChunkType chunkType;

    @Column(name = "line_start")
    private int lineStart;

    @Column(name = "line_end")
    private int lineEnd;

    @Column(length = 50)
    private String language;

    //  the dimension must match the configured embedding model
    @Column(name = "embedding", columnDefinition = "vector(768)")
    @JdbcTypeCode(SqlTypes.VECTOR)
    private float[] embedding;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;
}
