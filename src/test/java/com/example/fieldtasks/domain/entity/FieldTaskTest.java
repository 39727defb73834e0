package com.example.fieldtasks.domain.entity;

import com.example.fieldtasks.domain.enums.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FieldTask Entity Tests")
class FieldTaskTest {

    private Instant now;
    private FieldTask task;

    @BeforeEach
    void setUp() {
        now = Instant.parse("2030-05-01T08:00:00Z");
        task = FieldTask.builder()
                .title("Inspect site A")
                .assignee("member1-sub")
                .deadline(now.plus(Duration.ofHours(2)))
                .build();
    }

    @Test
    @DisplayName("New tasks should default to New status")
    void shouldDefaultToNew() {
        assertThat(task.getStatus()).isEqualTo(TaskStatus.NEW);
    }

    @Test
    @DisplayName("Should set audit timestamps on create")
    void shouldSetTimestampsOnCreate() {
        task.setStatus(null);

        task.onCreate();

        assertThat(task.getCreatedAt()).isNotNull();
        assertThat(task.getUpdatedAt()).isNotNull();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.NEW);
    }

    @Test
    @DisplayName("Should match the assignee exactly")
    void shouldMatchAssignee() {
        assertThat(task.isAssignedTo("member1-sub")).isTrue();
        assertThat(task.isAssignedTo("member2-sub")).isFalse();
        assertThat(task.isAssignedTo(null)).isFalse();
    }

    @Nested
    @DisplayName("Deadline Tests")
    class DeadlineTests {

        @Test
        @DisplayName("Rescheduling should clear the alert marker")
        void rescheduleShouldClearMarker() {
            task.setDeadlineNotifiedAt(now);
            var newDeadline = now.plus(Duration.ofDays(3));

            task.rescheduleDeadline(newDeadline);

            assertThat(task.getDeadline()).isEqualTo(newDeadline);
            assertThat(task.getDeadlineNotifiedAt()).isNull();
        }
    }
}
