package com.example.fieldtasks.client;

import com.example.fieldtasks.client.ClientModels.CreateDirectoryUserRequest;
import com.example.fieldtasks.client.ClientModels.DirectoryUser;
import com.example.fieldtasks.client.ClientModels.DirectoryUserPage;
import com.example.fieldtasks.client.ClientModels.GroupMembershipRequest;
import com.example.fieldtasks.config.IdentityProviderProperties;
import com.example.fieldtasks.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Client for the identity provider's user directory.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry with exponential backoff on lookups
 * - WebClient with per-call timeouts
 */
@Slf4j
@Component
public class IdentityProviderClient {

    private static final String SERVICE_NAME = "Identity Provider";
    private static final int MAX_PAGES = 50;

    private final WebClient webClient;
    private final IdentityProviderProperties properties;

    public IdentityProviderClient(@Qualifier("identityProviderWebClient") WebClient webClient,
                                  IdentityProviderProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * List every user in the pool, following pagination tokens
     */
    @CircuitBreaker(name = "identityProvider")
    @Retry(name = "identityProvider")
    public List<DirectoryUser> listUsers() {
        log.debug("Listing users of pool {}", properties.getUserPoolId());

        try {
            var users = new ArrayList<DirectoryUser>();
            String nextToken = null;
            var pages = 0;
            do {
                var token = nextToken;
                var page = webClient.get()
                        .uri(uri -> uri.path("/pools/{poolId}/users")
                                .queryParamIfPresent("nextToken", Optional.ofNullable(token))
                                .build(properties.getUserPoolId()))
                        .retrieve()
                        .onStatus(HttpStatusCode::isError, response ->
                                response.bodyToMono(String.class)
                                        .defaultIfEmpty("")
                                        .flatMap(body -> Mono.error(
                                                new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                        .bodyToMono(DirectoryUserPage.class)
                        .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                        .block();
                if (page == null) {
                    break;
                }
                users.addAll(page.getUsers());
                nextToken = page.getNextToken();
                pages++;
            } while (nextToken != null && pages < MAX_PAGES);

            return users;
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to list users of pool {}: {}", properties.getUserPoolId(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Look up a single user by id. An unknown user is an empty result, not an error.
     */
    @CircuitBreaker(name = "identityProvider")
    @Retry(name = "identityProvider")
    public Optional<DirectoryUser> findUser(String userId) {
        log.debug("Looking up user {}", userId);

        try {
            var user = webClient.get()
                    .uri("/pools/{poolId}/users/{userId}", properties.getUserPoolId(), userId)
                    .exchangeToMono(response -> {
                        if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            return response.releaseBody().then(Mono.<DirectoryUser>empty());
                        }
                        if (response.statusCode().isError()) {
                            return response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.<DirectoryUser>error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body)));
                        }
                        return response.bodyToMono(DirectoryUser.class);
                    })
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
            return Optional.ofNullable(user);
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to look up user {}: {}", userId, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Create a user with a temporary password; the provider emails the invitation.
     */
    @CircuitBreaker(name = "identityProvider")
    public DirectoryUser createUser(CreateDirectoryUserRequest request) {
        log.info("Creating user {} in pool {}", request.getUsername(), properties.getUserPoolId());

        try {
            return webClient.post()
                    .uri("/pools/{poolId}/users", properties.getUserPoolId())
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(DirectoryUser.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to create user {}: {}", request.getUsername(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Add a user to a group
     */
    @CircuitBreaker(name = "identityProvider")
    @Retry(name = "identityProvider")
    public void addUserToGroup(String username, String groupName) {
        log.debug("Adding user {} to group {}", username, groupName);

        try {
            webClient.post()
                    .uri("/pools/{poolId}/users/{username}/groups", properties.getUserPoolId(), username)
                    .bodyValue(new GroupMembershipRequest(groupName))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .toBodilessEntity()
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to add user {} to group {}: {}", username, groupName, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }
}
