package com.repo.query.model.job;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
public interface AnalysisJobRepository extends JpaRepository<AnalysisJob, Long> {

    //  the most recent job is the authoritative one for status queries
    Optional<AnalysisJob> findFirstByRepositoryIdOrderByCreatedAtDescIdDesc(Long repositoryId);

    /**
     * writes the dispatch task id without touching the rest of the row, which a running pipeline may be updating
     *
     * @param jobId
     * @param taskId
     * @return
     */
    @Transactional
    @Modifying
    @Query("UPDATE AnalysisJob j SET j.taskId = :taskId WHERE j.id = :jobId")
    int assignTaskId(@Param("jobId") Long jobId, @Param("taskId") String taskId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM AnalysisJob j WHERE j.repositoryId = :repositoryId")
    int deleteByRepositoryId(@Param("repositoryId") Long repositoryId);
}
