package com.example.fieldtasks.domain.repository;

import com.example.fieldtasks.domain.entity.FieldTask;
import com.example.fieldtasks.domain.enums.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for FieldTask entity.
 * <p>
 * Primary access is by id, the secondary path is by assignee.
 * The deadline marker is claimed with a conditional update so that
 * concurrent or repeated scans alert each deadline once.
 */
@Repository
public interface FieldTaskRepository extends JpaRepository<FieldTask, UUID> {

    List<FieldTask> findAllByOrderByCreatedAtAsc();

    List<FieldTask> findByStatusOrderByCreatedAtAsc(TaskStatus status);

    List<FieldTask> findByAssigneeOrderByCreatedAtAsc(String assignee);

    List<FieldTask> findByAssigneeAndStatusOrderByCreatedAtAsc(String assignee, TaskStatus status);

    long countByStatus(TaskStatus status);

    /**
     * Find open tasks whose deadline is at or before the horizon and that have
     * not been alerted yet. Overdue tasks qualify too.
     */
    @Query("""
            SELECT t FROM FieldTask t
            WHERE t.status <> :excludedStatus
              AND t.deadline <= :horizon
              AND t.deadlineNotifiedAt IS NULL
            ORDER BY t.deadline ASC
            """)
    List<FieldTask> findDeadlineAlertCandidates(@Param("excludedStatus") TaskStatus excludedStatus,
                                                @Param("horizon") Instant horizon,
                                                Pageable pageable);

    /**
     * Claim the deadline alert for a task. Bumps the version so that an update
     * loaded before the claim fails instead of clearing the marker.
     *
     * @return 1 if this caller set the marker, 0 if it was already set
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE FieldTask t
            SET t.deadlineNotifiedAt = :now,
                t.version = t.version + 1
            WHERE t.id = :taskId
              AND t.deadlineNotifiedAt IS NULL
            """)
    int claimDeadlineAlert(@Param("taskId") UUID taskId, @Param("now") Instant now);
}
