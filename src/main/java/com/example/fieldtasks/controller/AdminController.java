package com.example.fieldtasks.controller;

import com.example.fieldtasks.dto.ApiResponse;
import com.example.fieldtasks.dto.DeadlineScanResult;
import com.example.fieldtasks.security.AccessPolicy;
import com.example.fieldtasks.security.Caller;
import com.example.fieldtasks.service.deadline.DeadlineScannerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/admin")
@Tag(name = "Administration", description = "Operational endpoints for admins")
public class AdminController {

    private final DeadlineScannerService deadlineScannerService;
    private final AccessPolicy accessPolicy;

    @PostMapping("/deadline-scan")
    @Operation(summary = "Run the deadline scan now", description = "Alerts tasks nearing their deadline that were not alerted yet")
    public ResponseEntity<ApiResponse<DeadlineScanResult>> runDeadlineScan(@Parameter(hidden = true) Caller caller) {
        accessPolicy.requireAdmin(caller, "run the deadline scan");
        log.info("API: Manual deadline scan triggered by {}", caller.username());

        var result = deadlineScannerService.scan(Instant.now());
        return ResponseEntity.ok(ApiResponse.success(result, String.format("Alerted %d tasks", result.getAlerted())));
    }
}
