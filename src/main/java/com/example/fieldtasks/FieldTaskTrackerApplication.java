package com.example.fieldtasks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Field Task Tracker Application
 * <p>
 * Back end for a field team's task board: admins create and assign tasks,
 * members progress the tasks assigned to them.
 * <p>
 * Features:
 * - Role-based task CRUD behind JWT bearer authentication
 * - Assignment emails and status-change pushes to the team channel
 * - Hourly deadline scan with a once-per-deadline alert marker
 * - Distributed scan locking for multi-instance deployments
 */
@EnableScheduling
@SpringBootApplication
public class FieldTaskTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FieldTaskTrackerApplication.class, args);
    }
}
