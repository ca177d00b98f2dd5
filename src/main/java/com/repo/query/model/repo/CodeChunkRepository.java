package com.repo.query.model.repo;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CodeChunkRepository extends JpaRepository<CodeChunk, Long> {

    /**
     * finds the chunks of one repository closest to the query vector.
     * '<=>' is the pgvector cosine distance operator, so similarity is 1 - distance.
     * equal distances are ordered by chunk id.
     *
     * @param repositoryId
     * @param embedding the query vector
     * @param limit how many results to return
     * @return
     */
    @Query(value = """
            SELECT id AS "id", file_path AS "filePath", chunk_text AS "chunkText",
                   chunk_type AS "chunkType", line_start AS "lineStart", line_end AS "lineEnd",
                   language AS "language",
                   1 - (embedding <=> cast(:embedding as vector)) AS "similarity"
            FROM code_chunks
            WHERE repository_id = :repositoryId
              AND embedding IS NOT NULL
            ORDER BY embedding <=> cast(:embedding as vector), id
            LIMIT :limit
            """, nativeQuery = true)
    List<ChunkMatch> findNearestByRepo(
            @Param("repositoryId") Long repositoryId,
            @Param("embedding") float[] embedding,
            @Param("limit") int limit
    );

    long countByRepositoryIdAndChunkType(Long repositoryId, ChunkType chunkType);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CodeChunk c WHERE c.repositoryId = :repositoryId")
    int deleteByRepositoryId(@Param("repositoryId") Long repositoryId);
}
