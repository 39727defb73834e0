package com.example.fieldtasks.domain.entity;

import com.example.fieldtasks.domain.enums.TaskStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A unit of field work assigned to one team member.
 * <p>
 * Tasks are looked up by id or by assignee; the deadline scan reads
 * status, deadline and the notification marker.
 */
@Entity
@Table(name = "field_tasks", indexes = {
        @Index(name = "idx_field_tasks_assignee", columnList = "assignee"),
        @Index(name = "idx_field_tasks_status_deadline", columnList = "status, deadline")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FieldTask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", length = 2000)
    private String description;

    /**
     * Identity provider user id (subject) of the assigned member
     */
    @Column(name = "assignee", nullable = false, length = 100)
    private String assignee;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private TaskStatus status = TaskStatus.NEW;

    @Column(name = "deadline", nullable = false)
    private Instant deadline;

    /**
     * Set by the deadline scan once an alert went out for the current deadline
     */
    @Column(name = "deadline_notified_at")
    private Instant deadlineNotifiedAt;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
        if (this.status == null) {
            this.status = TaskStatus.NEW;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    public boolean isAssignedTo(String userId) {
        return assignee != null && assignee.equals(userId);
    }

    /**
     * Move the deadline; a new deadline gets its own alert
     */
    public void rescheduleDeadline(Instant newDeadline) {
        this.deadline = newDeadline;
        this.deadlineNotifiedAt = null;
    }
}
