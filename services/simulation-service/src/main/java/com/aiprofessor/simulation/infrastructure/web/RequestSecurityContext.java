package com.aiprofessor.simulation.infrastructure.web;

import com.aiprofessor.security.PlatformSecurityContext;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/** Stores the verified caller on the servlet request. */
public final class RequestSecurityContext {

    static final String ATTRIBUTE = RequestSecurityContext.class.getName();

    private RequestSecurityContext() {
        // utility class
    }

    public static void attach(HttpServletRequest request, PlatformSecurityContext context) {
        request.setAttribute(ATTRIBUTE, context);
    }

    public static Optional<PlatformSecurityContext> find(HttpServletRequest request) {
        Object value = request.getAttribute(ATTRIBUTE);
        return value instanceof PlatformSecurityContext
                ? Optional.of((PlatformSecurityContext) value)
                : Optional.empty();
    }
}
