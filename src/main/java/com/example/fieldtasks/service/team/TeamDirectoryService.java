package com.example.fieldtasks.service.team;

import com.example.fieldtasks.client.ClientModels.CreateDirectoryUserRequest;
import com.example.fieldtasks.client.ClientModels.DirectoryUser;
import com.example.fieldtasks.client.IdentityProviderClient;
import com.example.fieldtasks.config.IdentityProviderProperties;
import com.example.fieldtasks.dto.CreateTeamMemberRequest;
import com.example.fieldtasks.dto.TeamMemberResponse;
import com.example.fieldtasks.exception.TaskValidationException;
import com.example.fieldtasks.mapper.TeamMemberMapper;
import com.example.fieldtasks.security.AccessPolicy;
import com.example.fieldtasks.security.Caller;
import com.example.fieldtasks.security.Roles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Team membership as seen through the identity provider's user directory.
 * <p>
 * Users are owned by the identity provider; this service only reads them,
 * validates assignees, and invites new members.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TeamDirectoryService {

    private final IdentityProviderClient identityProviderClient;
    private final IdentityProviderProperties properties;
    private final TeamMemberMapper teamMemberMapper;
    private final AccessPolicy accessPolicy;

    /**
     * List the team for assignment and oversight. Admin only.
     */
    public List<TeamMemberResponse> listTeamMembers(Caller caller) {
        accessPolicy.requireAdmin(caller, "list users");

        var users = identityProviderClient.listUsers().stream()
                .sorted(Comparator.comparing(DirectoryUser::getUsername, Comparator.nullsLast(String::compareToIgnoreCase)))
                .toList();
        return teamMemberMapper.toResponseList(users);
    }

    /**
     * Invite a new member: create the directory user and add it to the member group. Admin only.
     */
    public TeamMemberResponse createTeamMember(Caller caller, CreateTeamMemberRequest request) {
        accessPolicy.requireAdmin(caller, "create users");

        var temporaryPassword = request.getTemporaryPassword() != null && !request.getTemporaryPassword().isBlank()
                ? request.getTemporaryPassword()
                : properties.getDefaultTemporaryPassword();

        var created = identityProviderClient.createUser(CreateDirectoryUserRequest.builder()
                .username(request.getUsername())
                .email(request.getEmail())
                .emailVerified(true)
                .temporaryPassword(temporaryPassword)
                .deliveryMedium("EMAIL")
                .build());
        identityProviderClient.addUserToGroup(request.getUsername(), Roles.MEMBER_GROUP);

        if (created == null) {
            created = DirectoryUser.builder().username(request.getUsername()).email(request.getEmail()).enabled(true).build();
        }
        var groups = created.getGroups() != null ? new ArrayList<>(created.getGroups()) : new ArrayList<String>();
        if (!groups.contains(Roles.MEMBER_GROUP)) {
            groups.add(Roles.MEMBER_GROUP);
        }
        created.setGroups(groups);

        log.info("User {} created by {} and added to the {} group", request.getUsername(), caller.username(), Roles.MEMBER_GROUP);
        return teamMemberMapper.toResponse(created);
    }

    /**
     * Resolve a prospective assignee; it must exist and have an email address
     * to receive the assignment notice.
     *
     * @throws TaskValidationException if the user is unknown or has no email
     */
    public DirectoryUser requireAssignableMember(String userId) {
        var user = identityProviderClient.findUser(userId)
                .orElseThrow(() -> new TaskValidationException("assignee", "Assigned user " + userId + " not found"));

        if (!user.hasEmail()) {
            log.warn("User {} ({}) has no email address and cannot be assigned", userId, user.getUsername());
            throw new TaskValidationException("assignee", "Assigned user " + userId + " does not have an email address");
        }
        return user;
    }

    /**
     * Best-effort lookup used to enrich notifications
     */
    public Optional<DirectoryUser> findMember(String userId) {
        try {
            return identityProviderClient.findUser(userId);
        } catch (Exception e) {
            log.warn("Could not look up user {}: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }
}
