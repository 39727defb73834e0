package com.example.fieldtasks.dto;

import com.example.fieldtasks.domain.enums.TeamRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A directory user as shown in the assignment and oversight views
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamMemberResponse {
    private String userId;
    private String username;
    private String email;
    private TeamRole role;
    private boolean enabled;
    private String status;
}
