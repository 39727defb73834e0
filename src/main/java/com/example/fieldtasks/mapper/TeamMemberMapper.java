package com.example.fieldtasks.mapper;

import com.example.fieldtasks.client.ClientModels.DirectoryUser;
import com.example.fieldtasks.domain.enums.TeamRole;
import com.example.fieldtasks.dto.TeamMemberResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for directory users; the role is derived from group membership
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE, imports = TeamRole.class)
public interface TeamMemberMapper {

    @Mapping(target = "role", expression = "java(TeamRole.fromGroups(user.getGroups()))")
    TeamMemberResponse toResponse(DirectoryUser user);

    List<TeamMemberResponse> toResponseList(List<DirectoryUser> users);
}
