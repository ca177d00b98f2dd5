package com.repo.query.model.question;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface QuestionRepository extends JpaRepository<Question, Long> {

    Page<Question> findByRepositoryIdOrderByCreatedAtDescIdDesc(Long repositoryId, Pageable pageable);

    long countByRepositoryId(Long repositoryId);

    @Query("SELECT AVG(q.processingTimeMs) FROM Question q WHERE q.repositoryId = :repositoryId")
    Double averageProcessingTimeMs(@Param("repositoryId") Long repositoryId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Question q WHERE q.repositoryId = :repositoryId")
    int deleteByRepositoryId(@Param("repositoryId") Long repositoryId);
}
