package com.example.mediagen_backend.repository;

import com.example.mediagen_backend.model.JobHistoryRecord;
import com.example.mediagen_backend.util.JobType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Repository for terminal job records.
 */
public interface JobHistoryRepository extends JpaRepository<JobHistoryRecord, String> {
    /**
     * Latest records of one type, newest first.
     *
     * @param type job type.
     * @param pageable page size and offset.
     * @return records ordered by finish time descending.
     */
    List<JobHistoryRecord> findByTypeOrderByFinishedAtDesc(JobType type, Pageable pageable);

    List<JobHistoryRecord> findAllByOrderByFinishedAtDesc(Pageable pageable);

    long countByTypeAndStatus(JobType type, String status);
}
