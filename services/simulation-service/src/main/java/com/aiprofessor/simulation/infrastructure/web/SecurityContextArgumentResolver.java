package com.aiprofessor.simulation.infrastructure.web;

import com.aiprofessor.security.InvalidTokenException;
import com.aiprofessor.security.PlatformSecurityContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/** Injects the verified caller into handler methods declaring a {@link PlatformSecurityContext}. */
public class SecurityContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return PlatformSecurityContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (request == null) {
            throw new InvalidTokenException("No servlet request");
        }
        return RequestSecurityContext.find(request)
                .orElseThrow(() -> new InvalidTokenException("Request is not authenticated"));
    }
}
