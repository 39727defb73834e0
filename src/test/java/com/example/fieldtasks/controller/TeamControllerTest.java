package com.example.fieldtasks.controller;

import com.example.fieldtasks.domain.enums.TeamRole;
import com.example.fieldtasks.dto.CreateTeamMemberRequest;
import com.example.fieldtasks.dto.TeamMemberResponse;
import com.example.fieldtasks.exception.ExternalServiceException;
import com.example.fieldtasks.exception.GlobalExceptionHandler;
import com.example.fieldtasks.exception.TaskAuthorizationException;
import com.example.fieldtasks.security.Caller;
import com.example.fieldtasks.service.team.TeamDirectoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("TeamController Tests")
class TeamControllerTest {

    @Mock
    private TeamDirectoryService teamDirectoryService;

    @InjectMocks
    private TeamController teamController;

    private final Caller admin = new Caller("admin-sub", "admin", TeamRole.ADMIN);

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(teamController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new FixedCallerResolver())
                .build();
    }

    private class FixedCallerResolver implements HandlerMethodArgumentResolver {

        @Override
        public boolean supportsParameter(MethodParameter parameter) {
            return Caller.class.equals(parameter.getParameterType());
        }

        @Override
        public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                      NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
            return admin;
        }
    }

    @Nested
    @DisplayName("List Users Tests")
    class ListUsersTests {

        @Test
        @DisplayName("Should list directory users")
        void shouldListUsers() throws Exception {
            // Given
            when(teamDirectoryService.listTeamMembers(admin)).thenReturn(List.of(TeamMemberResponse.builder()
                    .userId("member1-sub")
                    .username("member1")
                    .email("member1@example.com")
                    .role(TeamRole.MEMBER)
                    .enabled(true)
                    .status("CONFIRMED")
                    .build()));

            // When / Then
            mockMvc.perform(get("/api/v1/users"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[0].username").value("member1"))
                    .andExpect(jsonPath("$.data[0].enabled").value(true));
        }

        @Test
        @DisplayName("Should return 403 for a member")
        void shouldRejectMember() throws Exception {
            when(teamDirectoryService.listTeamMembers(admin))
                    .thenThrow(new TaskAuthorizationException("Only admins can list users"));

            mockMvc.perform(get("/api/v1/users"))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("Should return 502 when the directory answers 404")
        void shouldMapUpstreamNotFoundToBadGateway() throws Exception {
            when(teamDirectoryService.listTeamMembers(admin))
                    .thenThrow(new ExternalServiceException("Identity Provider", 404, "ResourceNotFoundException"));

            mockMvc.perform(get("/api/v1/users"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.success").value(false));
        }

        @Test
        @DisplayName("Should return 502 when the directory answers 403")
        void shouldMapUpstreamForbiddenToBadGateway() throws Exception {
            when(teamDirectoryService.listTeamMembers(admin))
                    .thenThrow(new ExternalServiceException("Identity Provider", 403, "AccessDeniedException"));

            mockMvc.perform(get("/api/v1/users"))
                    .andExpect(status().isBadGateway());
        }
    }

    @Nested
    @DisplayName("Create User Tests")
    class CreateUserTests {

        @Test
        @DisplayName("Should create a user and return 201")
        void shouldCreateUser() throws Exception {
            when(teamDirectoryService.createTeamMember(eq(admin), any(CreateTeamMemberRequest.class)))
                    .thenReturn(TeamMemberResponse.builder()
                            .userId("member3-sub")
                            .username("member3")
                            .email("member3@example.com")
                            .role(TeamRole.MEMBER)
                            .enabled(true)
                            .build());

            mockMvc.perform(post("/api/v1/users")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"username":"member3","email":"member3@example.com"}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.data.userId").value("member3-sub"));
        }

        @Test
        @DisplayName("Should return 400 without an email")
        void shouldRejectMissingEmail() throws Exception {
            mockMvc.perform(post("/api/v1/users")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"username":"member3"}
                                    """))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(teamDirectoryService);
        }
    }
}
