package com.example.minimap_backend.repository;

import com.example.minimap_backend.model.Job;
import com.example.minimap_backend.util.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface JobRepository extends JpaRepository<Job, UUID> {

    List<Job> findByOwnerTokenOrderByCreatedAtDesc(String ownerToken);

    List<Job> findAllByOrderByCreatedAtDesc();

    List<Job> findByStatusOrderByCreatedAtAsc(JobStatus status);

    List<Job> findByStatusInAndCompletedAtBefore(Collection<JobStatus> statuses, Instant cutoff);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from Job j where j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Ownership token: only one caller can move a given job out of QUEUED.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Job j
           set j.status = com.example.minimap_backend.util.JobStatus.PROCESSING,
               j.message = :message,
               j.version = j.version + 1
         where j.id = :id
           and j.status = com.example.minimap_backend.util.JobStatus.QUEUED
        """)
    int markProcessing(@Param("id") UUID id, @Param("message") String message);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        delete from Job j
         where j.id = :id
           and j.status = com.example.minimap_backend.util.JobStatus.QUEUED
        """)
    int deleteIfQueued(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Job j where j.id = :id")
    int purgeById(@Param("id") UUID id);
}
