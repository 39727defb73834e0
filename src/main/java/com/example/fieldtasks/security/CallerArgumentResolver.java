package com.example.fieldtasks.security;

import com.example.fieldtasks.domain.enums.TeamRole;
import com.example.fieldtasks.exception.TaskAuthorizationException;
import org.springframework.core.MethodParameter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link Caller} controller parameters from the JWT authentication.
 */
@Component
public class CallerArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Caller.class.equals(parameter.getParameterType());
    }

    @Override
    public Caller resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        var authentication = SecurityContextHolder.getContext().getAuthentication();
        if (!(authentication instanceof JwtAuthenticationToken token)) {
            throw new TaskAuthorizationException("No authenticated caller");
        }
        return toCaller(token);
    }

    static Caller toCaller(JwtAuthenticationToken token) {
        var admin = token.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(Roles.AUTHORITY_ADMIN::equals);
        return new Caller(token.getToken().getSubject(), token.getName(), admin ? TeamRole.ADMIN : TeamRole.MEMBER);
    }
}
