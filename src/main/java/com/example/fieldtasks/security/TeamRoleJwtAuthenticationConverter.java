package com.example.fieldtasks.security;

import com.example.fieldtasks.config.IdentityProviderProperties;
import com.example.fieldtasks.domain.enums.TeamRole;
import lombok.RequiredArgsConstructor;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps the identity provider's group claim to a single team role authority.
 * The token name is the caller's username claim, or the subject when absent.
 */
@Component
@RequiredArgsConstructor
public class TeamRoleJwtAuthenticationConverter implements Converter<Jwt, AbstractAuthenticationToken> {

    private final IdentityProviderProperties properties;

    @Override
    public AbstractAuthenticationToken convert(Jwt jwt) {
        var role = TeamRole.fromGroups(jwt.getClaimAsStringList(properties.getGroupsClaim()));
        var username = jwt.getClaimAsString(properties.getUsernameClaim());
        var name = username != null && !username.isBlank() ? username : jwt.getSubject();
        return new JwtAuthenticationToken(jwt, List.of(new SimpleGrantedAuthority(role.getAuthority())), name);
    }
}
