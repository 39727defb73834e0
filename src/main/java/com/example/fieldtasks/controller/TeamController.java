package com.example.fieldtasks.controller;

import com.example.fieldtasks.dto.ApiResponse;
import com.example.fieldtasks.dto.CreateTeamMemberRequest;
import com.example.fieldtasks.dto.TeamMemberResponse;
import com.example.fieldtasks.security.Caller;
import com.example.fieldtasks.service.team.TeamDirectoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Team directory endpoints. Admin only.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/users")
@Tag(name = "Team", description = "APIs for listing and inviting team members")
public class TeamController {

    private final TeamDirectoryService teamDirectoryService;

    @GetMapping
    @Operation(summary = "List users", description = "List directory users with role, email and status")
    public ResponseEntity<ApiResponse<List<TeamMemberResponse>>> listUsers(@Parameter(hidden = true) Caller caller) {
        return ResponseEntity.ok(ApiResponse.success(teamDirectoryService.listTeamMembers(caller)));
    }

    @PostMapping
    @Operation(summary = "Create a user", description = "Create a directory user with a temporary password and add it to the member group")
    public ResponseEntity<ApiResponse<TeamMemberResponse>> createUser(@Parameter(hidden = true) Caller caller,
                                                                      @Valid @RequestBody CreateTeamMemberRequest request) {
        log.info("API: Create user {} by {}", request.getUsername(), caller.username());

        var response = teamDirectoryService.createTeamMember(caller, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "User created successfully"));
    }
}
