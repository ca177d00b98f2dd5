package com.repo.query.model.repo;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

@Repository
public interface RepoRepository extends JpaRepository<Repo, Long> {

    Optional<Repo> findByRepoUrl(String repoUrl);

    /**
     * lists repositories with optional status and name/url filters, newest first
     *
     * @param status
     * @param search lower-cased search term, or null
     * @param pageable
     * @return
     */
    @Query("""
            SELECT r FROM Repo r
            WHERE (:status IS NULL OR r.status = :status)
              AND (:search IS NULL
                   OR LOWER(r.name) LIKE CONCAT('%', :search, '%')
                   OR LOWER(r.repoUrl) LIKE CONCAT('%', :search, '%'))
            ORDER BY r.createdAt DESC
            """)
    Page<Repo> search(@Param("status") RepoStatus status, @Param("search") String search, Pageable pageable);

    @Transactional
    @Modifying
    @Query("UPDATE Repo r SET r.status = :status, r.updatedAt = :now WHERE r.id = :id")
    int updateStatus(@Param("id") Long id, @Param("status") RepoStatus status, @Param("now") Instant now);

    /**
     * moves the repository back to pending, but only from one of the given states.
     * Two concurrent callers cannot both succeed.
     *
     * @param id
     * @param from states a new analysis may start from
     * @param now
     * @return 1 when the reset happened, 0 otherwise
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Repo r SET r.status = com.repo.query.model.repo.RepoStatus.PENDING, r.updatedAt = :now
            WHERE r.id = :id AND r.status IN :from
            """)
    int resetForReanalysis(@Param("id") Long id, @Param("from") Collection<RepoStatus> from, @Param("now") Instant now);
}
