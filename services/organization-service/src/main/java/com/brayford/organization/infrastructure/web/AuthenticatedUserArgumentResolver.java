package com.brayford.organization.infrastructure.web;

import com.brayford.observability.CorrelationContextHolder;
import com.brayford.security.AuthenticatedUser;
import com.brayford.security.AuthenticatedUserSerializer;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies an {@link AuthenticatedUser} controller parameter from the
 * {@value AuthenticatedUserSerializer#HEADER} header set by the gateway, and records the user id in
 * the correlation context.
 */
public class AuthenticatedUserArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AuthenticatedUser.class.equals(parameter.getParameterType());
    }

    @Override
    public AuthenticatedUser resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        String header = webRequest.getHeader(AuthenticatedUserSerializer.HEADER);
        if (header == null || header.isBlank()) {
            throw new MissingCallerException("missing");
        }
        AuthenticatedUser caller;
        try {
            caller = AuthenticatedUserSerializer.deserialize(header);
        } catch (AuthenticatedUserSerializer.CallerSerializationException e) {
            throw new MissingCallerException("malformed");
        }
        CorrelationContextHolder.update(ctx -> ctx.withUser(caller.userId()));
        return caller;
    }
}
